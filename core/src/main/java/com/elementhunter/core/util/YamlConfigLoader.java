package com.elementhunter.core.util;

import com.elementhunter.core.model.CrawlConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * crawl.yml 을 읽어 CrawlConfig 로 변환.
 *
 * 예상 YAML 키:
 * target: "https://example.com"
 * timeoutMs: 30000
 * userAgent: "ElementHunter/0.1 (+crawler)"
 * scope:
 *   maxDepth: 3
 *   maxPages: 50
 * politeness:
 *   delayMs: 1000
 * site:
 *   id: "example"
 *   name: "Example"
 * analysis:
 *   commonThreshold: 0.8
 *   rareThreshold: 5
 * output:
 *   dir: "data/sites"
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "crawl.yml";

    private YamlConfigLoader() {}

    public static CrawlConfig loadDefault() throws IOException {
        return load(Path.of(DEFAULT_FILE));
    }

    /**
     * YAML 을 읽어 설정을 채운다. target 은 CLI 에서 줄 수 있으므로 여기서는 validate 하지 않는다.
     *
     * @throws IOException 파일이 없거나 읽을 수 없을 때
     * @throws IllegalArgumentException 숫자 키에 숫자가 아닌 값이 들어있을 때
     */
    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("crawl.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            LoaderOptions opts = new LoaderOptions();
            Yaml yaml = new Yaml(new SafeConstructor(opts));
            Object root = yaml.load(in);

            CrawlConfig cfg = CrawlConfig.defaults();

            if (!(root instanceof Map<?, ?> map)) {
                // 비어있거나 단순 스칼라면 defaults 유지
                return cfg;
            }

            // 1) 평면 키
            setString(map, "target", cfg::setTarget);
            setLong(map, "timeoutMs", cfg::setTimeoutMs);
            setString(map, "userAgent", cfg::setUserAgent);
            setBoolean(map, "verbose", cfg::setVerbose);

            // 2) scope.*
            Map<String, Object> scope = getMap(map, "scope");
            if (scope != null) {
                setInt(scope, "maxDepth", cfg::setMaxDepth);
                setInt(scope, "maxPages", cfg::setMaxPages);
            }

            // 3) politeness.delayMs
            Map<String, Object> politeness = getMap(map, "politeness");
            if (politeness != null) {
                setLong(politeness, "delayMs", cfg::setDelayMs);
            }

            // 4) site.id / site.name
            Map<String, Object> site = getMap(map, "site");
            if (site != null) {
                setString(site, "id", cfg::setSiteId);
                setString(site, "name", cfg::setSiteName);
            }

            // 5) analysis.*
            Map<String, Object> analysis = getMap(map, "analysis");
            if (analysis != null) {
                setDouble(analysis, "commonThreshold", cfg::setCommonThreshold);
                setInt(analysis, "rareThreshold", cfg::setRareThreshold);
            }

            // 6) output.dir
            Map<String, Object> output = getMap(map, "output");
            if (output != null) {
                setPath(output, "dir", cfg::setOutputDir);
            }
            return cfg;
        }
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(parse(key, v, Integer::parseInt));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(parse(key, v, Long::parseLong));
    }

    private static void setDouble(Map<?, ?> map, String key, DoubleConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.doubleValue());
        else if (v != null) setter.accept(parse(key, v, Double::parseDouble));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }

    private static <T> T parse(String key, Object v, java.util.function.Function<String, T> fn) {
        try {
            return fn.apply(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("crawl.yml: '" + key + "' must be a number: " + v, e);
        }
    }
}
