package com.elementhunter.cli;

import com.elementhunter.core.model.CrawlConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CliArgsTest {

    @Test
    @DisplayName("짧은/긴 옵션과 --opt=value 형식")
    void parsesOptions() throws Exception {
        CliArgs a = CliArgs.parse(new String[]{
                "https://example.com", "-o", "out", "-d", "2", "--max-pages=7", "--delay", "0",
                "-t", "5000", "-i", "ex", "-n", "Example", "--common-threshold", "0.9", "-v"});

        assertThat(a.url).isEqualTo("https://example.com");
        assertThat(a.output).isEqualTo(Path.of("out"));
        assertThat(a.maxDepth).isEqualTo(2);
        assertThat(a.maxPages).isEqualTo(7);
        assertThat(a.delayMs).isZero();
        assertThat(a.timeoutMs).isEqualTo(5000L);
        assertThat(a.siteId).isEqualTo("ex");
        assertThat(a.siteName).isEqualTo("Example");
        assertThat(a.commonThreshold).isEqualTo(0.9);
        assertThat(a.verbose).isTrue();
    }

    @Test
    @DisplayName("지정한 플래그만 덮어쓰고 나머지는 base 유지")
    void appliesOnlyGivenFlags() throws Exception {
        CrawlConfig base = CrawlConfig.defaults().setTarget("https://from-yaml.com").setMaxPages(20).setSiteName("Yaml");
        CrawlConfig c = CliArgs.parse(new String[]{"-d", "1"}).applyTo(base);

        assertThat(c.getTarget()).isEqualTo("https://from-yaml.com");
        assertThat(c.getMaxDepth()).isEqualTo(1);
        assertThat(c.getMaxPages()).isEqualTo(20);
        assertThat(c.getSiteName()).isEqualTo("Yaml");
        assertThat(base.getMaxDepth()).isEqualTo(CrawlConfig.DEFAULT_MAX_DEPTH);
    }

    @Test
    @DisplayName("음수 값은 파싱은 되고 검증 단계에서 거부된다")
    void negativeValuesReachValidation() throws Exception {
        CrawlConfig c = CliArgs.parse(new String[]{"https://example.com", "--delay", "-5"})
                .applyTo(CrawlConfig.defaults());
        assertThatThrownBy(c::validate).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("사용법 오류: 모르는 옵션, 값 누락, 숫자 아님, 인자 과다")
    void usageErrors() {
        assertThatThrownBy(() -> CliArgs.parse(new String[]{"--bogus"})).isInstanceOf(CliArgs.UsageException.class);
        assertThatThrownBy(() -> CliArgs.parse(new String[]{"https://a.com", "-d"})).isInstanceOf(CliArgs.UsageException.class);
        assertThatThrownBy(() -> CliArgs.parse(new String[]{"-p", "ten"})).isInstanceOf(CliArgs.UsageException.class);
        assertThatThrownBy(() -> CliArgs.parse(new String[]{"https://a.com", "https://b.com"}))
                .isInstanceOf(CliArgs.UsageException.class);
    }
}
