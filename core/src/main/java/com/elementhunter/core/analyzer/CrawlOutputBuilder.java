package com.elementhunter.core.analyzer;

import com.elementhunter.core.model.CrawlConfig;
import com.elementhunter.core.model.CrawlMetadata;
import com.elementhunter.core.model.CrawlOutput;
import com.elementhunter.core.model.ElementStat;
import com.elementhunter.core.model.PageOutput;
import com.elementhunter.core.model.PageRecord;
import com.elementhunter.core.model.SitePalette;
import com.elementhunter.core.util.UrlUtils;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 방문 페이지 + 설정 + 팔레트 + 시각 값으로 최종 산출물을 만든다.
 * 입력만으로 결과가 정해진다(시계/전역 상태 없음).
 */
public final class CrawlOutputBuilder {

    public static final String CRAWLER_VERSION = "0.1.0";

    private List<PageRecord> pages = List.of();
    private URI baseUrl;
    private CrawlConfig config;
    private SitePalette palette = SitePalette.DEFAULT;
    private Instant startedAt;
    private Instant finishedAt;

    public CrawlOutputBuilder pages(List<PageRecord> pages) { this.pages = List.copyOf(pages); return this; }
    public CrawlOutputBuilder baseUrl(URI baseUrl) { this.baseUrl = baseUrl; return this; }
    public CrawlOutputBuilder config(CrawlConfig config) { this.config = config; return this; }
    public CrawlOutputBuilder palette(SitePalette palette) { this.palette = palette == null ? SitePalette.DEFAULT : palette; return this; }
    public CrawlOutputBuilder startedAt(Instant startedAt) { this.startedAt = startedAt; return this; }
    public CrawlOutputBuilder finishedAt(Instant finishedAt) { this.finishedAt = finishedAt; return this; }

    public CrawlOutput build() {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(finishedAt, "finishedAt");

        Set<String> common = PostCrawlAnalyzer.detectCommonLinks(pages, config.getCommonThreshold());

        List<PageOutput> outPages = new ArrayList<>(pages.size());
        int totalElements = 0;
        for (PageRecord p : pages) {
            int width = PostCrawlAnalyzer.estimatedWidth(p.getTotalElementCount(), p.getContentLength());
            p.attachEstimatedWidth(width);
            totalElements += p.getTotalElementCount();
            outPages.add(new PageOutput(
                    p.getPath(), p.getDepth(), p.getTitle(), p.getElements(), p.getTotalElementCount(),
                    PostCrawlAnalyzer.filterCommonLinks(p.getLinks(), common),
                    p.getParentPath(), p.getContentLength(), width,
                    p.getTextContent(), p.getImageUrls(), p.getOgImage()));
        }

        String host = baseUrl.getHost() == null ? "" : baseUrl.getHost();
        String siteId = config.getSiteId() != null ? config.getSiteId() : generateSiteId(host);
        String siteName = config.getSiteName() != null ? config.getSiteName() : defaultSiteName(host);

        long durationMs = Math.max(0L, Duration.between(startedAt, finishedAt).toMillis());
        CrawlMetadata meta = new CrawlMetadata(
                finishedAt.toString(), CRAWLER_VERSION, pages.size(), totalElements,
                PostCrawlAnalyzer.maxDepth(pages), durationMs);

        Map<String, ElementStat> stats = PostCrawlAnalyzer.calculateElementStats(pages);

        return new CrawlOutput(
                siteId, siteName, UrlUtils.originString(baseUrl), meta, palette, outPages,
                PostCrawlAnalyzer.findDeepestPages(pages),
                PostCrawlAnalyzer.findRareElements(pages, config.getRareThreshold()),
                new ArrayList<>(common), stats);
    }

    /** 첫 페이지(루트) title 이 비어있지 않으면 그것, 아니면 호스트명 */
    private String defaultSiteName(String host) {
        if (!pages.isEmpty()) {
            String title = pages.get(0).getTitle();
            if (title != null && !title.isBlank()) return title.trim();
        }
        return host;
    }

    /** www. 제거 → 마지막 ".tld" 제거 → 영숫자 외 '-' → 소문자. 예: www.example.co.jp → example-co */
    public static String generateSiteId(String hostname) {
        if (hostname == null) return "";
        String s = hostname.replaceFirst("^www\\.", "");
        s = s.replaceFirst("\\.[^.]+$", "");
        s = s.replaceAll("[^A-Za-z0-9]", "-");
        return s.toLowerCase(Locale.ROOT);
    }
}
