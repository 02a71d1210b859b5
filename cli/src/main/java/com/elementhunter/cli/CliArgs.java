package com.elementhunter.cli;

import com.elementhunter.core.model.CrawlConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * eh-crawl 인자. 지정하지 않은 값은 null 로 남겨 crawl.yml/기본값을 덮지 않는다.
 */
final class CliArgs {

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: eh-crawl <url> [options]",
            "",
            "Options:",
            "  -o, --output <dir>          Output directory (default: data/sites)",
            "  -d, --max-depth <n>         Maximum crawl depth (default: 3)",
            "  -p, --max-pages <n>         Maximum pages to crawl (default: 50)",
            "      --delay <ms>            Delay between requests (default: 1000)",
            "  -t, --timeout <ms>          Page load timeout (default: 30000)",
            "  -i, --site-id <id>          Site ID (derived from hostname if omitted)",
            "  -n, --site-name <name>      Site name (root page title if omitted)",
            "      --common-threshold <n>  Common link threshold 0-1 (default: 0.8)",
            "  -c, --config <file>         crawl.yml to load before applying flags",
            "  -v, --verbose               Verbose output",
            "  -h, --help                  Show this help",
            "      --version               Show version");

    /** 사용법 오류(종료 코드 2) */
    static final class UsageException extends Exception {
        UsageException(String message) { super(message); }
    }

    String url;
    Path output;
    Integer maxDepth;
    Integer maxPages;
    Long delayMs;
    Long timeoutMs;
    String siteId;
    String siteName;
    Double commonThreshold;
    Path config;
    boolean verbose;
    boolean help;
    boolean version;

    static CliArgs parse(String[] argv) throws UsageException {
        CliArgs a = new CliArgs();
        List<String> positional = new ArrayList<>();
        for (int i = 0; i < argv.length; i++) {
            String arg = argv[i];
            String inline = null;
            if (arg.startsWith("--") && arg.contains("=")) {
                inline = arg.substring(arg.indexOf('=') + 1);
                arg = arg.substring(0, arg.indexOf('='));
            }
            switch (arg) {
                case "-h", "--help" -> a.help = true;
                case "--version" -> a.version = true;
                case "-v", "--verbose" -> a.verbose = true;
                case "-o", "--output" -> a.output = Path.of(value(argv, i, arg, inline));
                case "-d", "--max-depth" -> a.maxDepth = intValue(arg, value(argv, i, arg, inline));
                case "-p", "--max-pages" -> a.maxPages = intValue(arg, value(argv, i, arg, inline));
                case "--delay" -> a.delayMs = longValue(arg, value(argv, i, arg, inline));
                case "-t", "--timeout" -> a.timeoutMs = longValue(arg, value(argv, i, arg, inline));
                case "-i", "--site-id" -> a.siteId = value(argv, i, arg, inline);
                case "-n", "--site-name" -> a.siteName = value(argv, i, arg, inline);
                case "--common-threshold" -> a.commonThreshold = doubleValue(arg, value(argv, i, arg, inline));
                case "-c", "--config" -> a.config = Path.of(value(argv, i, arg, inline));
                default -> {
                    if (arg.startsWith("-") && arg.length() > 1) {
                        throw new UsageException("Unknown option: " + arg);
                    }
                    positional.add(arg);
                }
            }
            // 값을 다음 토큰에서 읽었으면 건너뜀
            if (inline == null && takesValue(arg)) i++;
        }
        if (positional.size() > 1) {
            throw new UsageException("Too many arguments: " + positional);
        }
        if (!positional.isEmpty()) a.url = positional.get(0);
        return a;
    }

    /**
     * base 위에 지정된 플래그만 덮어쓴다. base 는 바꾸지 않는다.
     */
    CrawlConfig applyTo(CrawlConfig base) {
        CrawlConfig c = base.copy();
        if (url != null) c.setTarget(url);
        if (output != null) c.setOutputDir(output);
        if (maxDepth != null) c.setMaxDepth(maxDepth);
        if (maxPages != null) c.setMaxPages(maxPages);
        if (delayMs != null) c.setDelay(Duration.ofMillis(delayMs));
        if (timeoutMs != null) c.setTimeout(Duration.ofMillis(timeoutMs));
        if (siteId != null) c.setSiteId(siteId);
        if (siteName != null) c.setSiteName(siteName);
        if (commonThreshold != null) c.setCommonThreshold(commonThreshold);
        if (verbose) c.setVerbose(true);
        return c;
    }

    private static boolean takesValue(String opt) {
        return switch (opt) {
            case "-o", "--output", "-d", "--max-depth", "-p", "--max-pages", "--delay",
                 "-t", "--timeout", "-i", "--site-id", "-n", "--site-name",
                 "--common-threshold", "-c", "--config" -> true;
            default -> false;
        };
    }

    private static String value(String[] argv, int i, String opt, String inline) throws UsageException {
        if (inline != null) return inline;
        if (i + 1 >= argv.length) throw new UsageException("Missing value for " + opt);
        return argv[i + 1];
    }

    private static int intValue(String opt, String v) throws UsageException {
        try { return Integer.parseInt(v.trim()); }
        catch (NumberFormatException e) { throw new UsageException(opt + " expects an integer: " + v); }
    }

    private static long longValue(String opt, String v) throws UsageException {
        try { return Long.parseLong(v.trim()); }
        catch (NumberFormatException e) { throw new UsageException(opt + " expects an integer: " + v); }
    }

    private static double doubleValue(String opt, String v) throws UsageException {
        try { return Double.parseDouble(v.trim().toLowerCase(Locale.ROOT)); }
        catch (NumberFormatException e) { throw new UsageException(opt + " expects a number: " + v); }
    }
}
