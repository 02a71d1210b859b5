package com.elementhunter.core.model;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * 크롤 설정 (crawl.yml / CLI 매핑 대상) — 순수 설정 보관용.
 * 크롤러는 validate() 통과한 설정만 받고, 실행 중 값을 바꾸지 않는다.
 */
public final class CrawlConfig {

    public static final int DEFAULT_MAX_DEPTH = 3;
    public static final int DEFAULT_MAX_PAGES = 50;
    public static final long DEFAULT_DELAY_MS = 1_000L;
    public static final long DEFAULT_TIMEOUT_MS = 30_000L;
    public static final double DEFAULT_COMMON_THRESHOLD = 0.8;
    public static final int DEFAULT_RARE_THRESHOLD = 5;
    public static final String DEFAULT_USER_AGENT = "ElementHunter/0.1 (+crawler)";

    // ---------- 기본 필드 ----------
    private String target;                              // 시작 URL (필수)
    private int maxDepth = DEFAULT_MAX_DEPTH;           // 최대 깊이
    private int maxPages = DEFAULT_MAX_PAGES;           // 최대 페이지 수
    private Duration delay = Duration.ofMillis(DEFAULT_DELAY_MS);      // 페이지 간 대기
    private Duration timeout = Duration.ofMillis(DEFAULT_TIMEOUT_MS);  // 페이지 로드 타임아웃
    private double commonThreshold = DEFAULT_COMMON_THRESHOLD;         // 공통 링크 판정 비율(0~1)
    private int rareThreshold = DEFAULT_RARE_THRESHOLD;                // 전체 출현 수 ≤ 이 값이면 레어
    private String siteId;                              // 없으면 호스트명에서 생성
    private String siteName;                            // 없으면 루트 페이지 title
    private Path outputDir = Path.of("data", "sites");
    private String userAgent = DEFAULT_USER_AGENT;
    private boolean verbose = false;

    // ---------- getters ----------
    public String getTarget() { return target; }
    public int getMaxDepth() { return maxDepth; }
    public int getMaxPages() { return maxPages; }
    public Duration getDelay() { return delay; }
    public Duration getTimeout() { return timeout; }
    public double getCommonThreshold() { return commonThreshold; }
    public int getRareThreshold() { return rareThreshold; }
    public String getSiteId() { return siteId; }
    public String getSiteName() { return siteName; }
    public Path getOutputDir() { return outputDir; }
    public String getUserAgent() { return userAgent; }
    public boolean isVerbose() { return verbose; }

    /** 밀리초(long) 반환 */
    public long getDelayMs() { return delay.toMillis(); }
    public long getTimeoutMs() { return timeout.toMillis(); }

    /** jsoup 등 int ms 필요 시 편의 메서드 */
    public int getTimeoutMsInt() {
        long ms = getTimeoutMs();
        return (ms > Integer.MAX_VALUE) ? Integer.MAX_VALUE : (int) ms;
    }

    // ---------- fluent setters ----------
    public CrawlConfig setTarget(String target) { this.target = target; return this; }
    public CrawlConfig setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; return this; }
    public CrawlConfig setMaxPages(int maxPages) { this.maxPages = maxPages; return this; }
    public CrawlConfig setDelay(Duration delay) { this.delay = delay; return this; }
    public CrawlConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CrawlConfig setCommonThreshold(double commonThreshold) { this.commonThreshold = commonThreshold; return this; }
    public CrawlConfig setRareThreshold(int rareThreshold) { this.rareThreshold = rareThreshold; return this; }
    public CrawlConfig setSiteId(String siteId) { this.siteId = blankToNull(siteId); return this; }
    public CrawlConfig setSiteName(String siteName) { this.siteName = blankToNull(siteName); return this; }
    public CrawlConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public CrawlConfig setVerbose(boolean verbose) { this.verbose = verbose; return this; }

    public CrawlConfig setUserAgent(String userAgent) {
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? DEFAULT_USER_AGENT : userAgent;
        return this;
    }

    /** 0 이하도 허용(대기 없음) — 음수는 0으로 */
    public CrawlConfig setDelayMs(long ms) {
        this.delay = Duration.ofMillis(Math.max(0, ms));
        return this;
    }

    public CrawlConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    // ---------- validate ----------
    /**
     * 설정 오류는 크롤 시작 전에 즉시 드러낸다.
     *
     * @throws IllegalArgumentException target 이 http(s) 절대 URL이 아니거나 범위를 벗어난 값
     */
    public void validate() {
        Objects.requireNonNull(target, "target");
        targetUri(); // URL 형식 검사
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        if (delay == null || delay.isNegative())
            throw new IllegalArgumentException("delay must be >= 0");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (Double.isNaN(commonThreshold) || commonThreshold < 0.0 || commonThreshold > 1.0)
            throw new IllegalArgumentException("commonThreshold must be within [0, 1]");
        if (rareThreshold < 0) throw new IllegalArgumentException("rareThreshold must be >= 0");
        Objects.requireNonNull(outputDir, "outputDir");
    }

    /**
     * target 을 URI로 파싱. http/https + host 가 없으면 설정 오류.
     */
    public URI targetUri() {
        if (target == null || target.isBlank()) throw new IllegalArgumentException("Invalid URL: (empty)");
        URI u;
        try {
            u = URI.create(target.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid URL: " + target, e);
        }
        String scheme = u.getScheme() == null ? "" : u.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https"))
            throw new IllegalArgumentException("Invalid URL (http/https only): " + target);
        if (u.getHost() == null || u.getHost().isBlank())
            throw new IllegalArgumentException("Invalid URL (no host): " + target);
        return u;
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }

    /** CLI 오버라이드 적용 전 복사본 */
    public CrawlConfig copy() {
        CrawlConfig c = new CrawlConfig();
        c.target = target;
        c.maxDepth = maxDepth;
        c.maxPages = maxPages;
        c.delay = delay;
        c.timeout = timeout;
        c.commonThreshold = commonThreshold;
        c.rareThreshold = rareThreshold;
        c.siteId = siteId;
        c.siteName = siteName;
        c.outputDir = outputDir;
        c.userAgent = userAgent;
        c.verbose = verbose;
        return c;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
