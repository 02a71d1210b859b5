package com.elementhunter.core.crawler;

import com.elementhunter.core.analyzer.CrawlOutputBuilder;
import com.elementhunter.core.api.ICrawler;
import com.elementhunter.core.api.PageDriver;
import com.elementhunter.core.extract.PageExtractor;
import com.elementhunter.core.model.CrawlConfig;
import com.elementhunter.core.model.CrawlOutput;
import com.elementhunter.core.model.ExtractedPage;
import com.elementhunter.core.model.PageRecord;
import com.elementhunter.core.model.SitePalette;
import com.elementhunter.core.util.ProgressListener;
import com.elementhunter.core.util.Sleeper;
import com.elementhunter.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * DFS 기반 Crawler
 * - 명시적 스택(LIFO), 자식은 역순으로 push → 재귀 DFS 와 같은 방문 순서
 * - pop 시점 게이트: 방문함 → 건너뜀 / depth > maxDepth → 건너뜀(방문 표시 안 함) / 페이지 수 상한 → 종료
 * - 루트는 한 번만 로드하고 팔레트를 뽑은 뒤 "이미 로드됨" 으로 depth 0 에 넣는다
 * - 페이지 단위 실패는 로그 후 건너뜀(재시도 없음)
 */
public class Crawler implements ICrawler {
    private static final Logger LOG = LoggerFactory.getLogger(Crawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(Crawler.class);

    private final PageDriver driver;
    private final PageExtractor extractor;
    private final Sleeper sleeper;
    private final Clock clock;
    private ProgressListener progress = ProgressListener.NONE;

    public Crawler(PageDriver driver) {
        this(driver, new PageExtractor(), Sleeper.THREAD, Clock.systemUTC());
    }

    public Crawler(PageDriver driver, PageExtractor extractor, Sleeper sleeper, Clock clock) {
        this.driver = Objects.requireNonNull(driver, "driver");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Crawler withProgress(ProgressListener listener) {
        this.progress = (listener == null) ? ProgressListener.NONE : listener;
        return this;
    }

    @Override
    public CrawlOutput crawl(CrawlConfig config) {
        Objects.requireNonNull(config, "config");
        config.validate();
        return crawl(new CrawlContext(config, clock.instant()));
    }

    /** 주어진 컨텍스트로 크롤. 끝난 뒤 방문 집합을 확인할 수 있다(같은 패키지 테스트용) */
    CrawlOutput crawl(CrawlContext ctx) {
        CrawlConfig config = ctx.config();
        driver.setTimeout(config.getTimeout());
        SLOG.info("crawl-start", "target", ctx.baseUrl().toString(),
                "maxDepth", config.getMaxDepth(), "maxPages", config.getMaxPages(),
                "delayMs", config.getDelayMs());

        SitePalette palette = SitePalette.DEFAULT;
        boolean rootLoaded = false;
        try {
            driver.navigate(ctx.urlFor("/"));
            rootLoaded = true;
        } catch (Exception e) {
            SLOG.warn("page-failed", e, "path", "/", "depth", 0);
            LOG.warn("root page failed: {} ({})", ctx.baseUrl(), e.getMessage());
            ctx.markVisited("/");
        }

        if (rootLoaded) {
            palette = extractPalette();
            traverse(ctx);
        }

        Instant finishedAt = clock.instant();
        progress.onProgress(ProgressListener.Phase.CRAWL, 1.0, ctx.pageCount(), config.getMaxPages());
        SLOG.info("crawl-done", "pages", ctx.pageCount(), "visited", ctx.visited().size(),
                "durationMs", finishedAt.toEpochMilli() - ctx.startedAt().toEpochMilli());

        return new CrawlOutputBuilder()
                .pages(ctx.pages())
                .baseUrl(ctx.baseUrl())
                .config(config)
                .palette(palette)
                .startedAt(ctx.startedAt())
                .finishedAt(finishedAt)
                .build();
    }

    private SitePalette extractPalette() {
        try {
            SitePalette p = extractor.extractPalette(driver).orElse(SitePalette.DEFAULT);
            LOG.debug("site palette: bg={} primary={}", p.backgroundColor(), p.primaryColor());
            return p;
        } catch (RuntimeException e) {
            SLOG.warn("palette-fallback", e);
            return SitePalette.DEFAULT;
        }
    }

    private void traverse(CrawlContext ctx) {
        CrawlConfig config = ctx.config();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(new Node("/", 0, true));

        while (!stack.isEmpty()) {
            Node cur = stack.pop();
            if (Thread.currentThread().isInterrupted()) {
                SLOG.warn("crawl-interrupted", "pages", ctx.pageCount());
                break;
            }
            String path = LinkNormalizer.normalizePath(cur.path);
            if (ctx.isVisited(path)) continue;
            if (cur.depth > config.getMaxDepth()) continue;
            if (ctx.pageCount() >= config.getMaxPages()) break;

            ctx.markVisited(path);
            List<String> children = visit(ctx, path, cur.depth, cur.alreadyLoaded);

            // 역순 push → 문서 순서대로 pop
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Node(children.get(i), cur.depth + 1, false));
            }
        }
    }

    /** 성공하면 기록하고 자식 경로를, 실패하면 빈 목록을 돌려준다 */
    private List<String> visit(CrawlContext ctx, String path, int depth, boolean alreadyLoaded) {
        CrawlConfig config = ctx.config();
        URI url = ctx.urlFor(path);
        int seq = ctx.nextExtractionId();
        LOG.debug("[{}/{}] crawling {} (depth {})", ctx.pageCount() + 1, config.getMaxPages(), path, depth);
        try {
            if (!alreadyLoaded) driver.navigate(url);
            politenessDelay(config);

            ExtractedPage extracted = extractor.extract(driver, ctx.baseUrl());
            Set<String> links = LinkNormalizer.normalizeLinks(extracted.rawLinks(), ctx.baseUrl());

            PageRecord record = new PageRecord(path, depth, extracted, new ArrayList<>(links));
            if (depth > 0) record.attachParentPath(ctx.findParentPath(path));
            ctx.addPage(record);

            SLOG.debug("page-done", "seq", seq, "path", path, "depth", depth,
                    "elements", record.getTotalElementCount(), "links", links.size(),
                    "contentLength", record.getContentLength());
            progress.onProgress(ProgressListener.Phase.CRAWL, ctx.pageCount() / (double) config.getMaxPages(),
                    ctx.pageCount(), config.getMaxPages());
            return new ArrayList<>(links);
        } catch (Exception e) {
            SLOG.warn("page-failed", e, "seq", seq, "path", path, "depth", depth);
            return List.of();
        }
    }

    private void politenessDelay(CrawlConfig config) {
        if (config.getDelayMs() <= 0) return;
        try {
            sleeper.sleep(config.getDelay());
        } catch (InterruptedException ie) {
            // 다음 게이트에서 멈춘다
            Thread.currentThread().interrupt();
        }
    }

    private static final class Node {
        final String path; final int depth; final boolean alreadyLoaded;
        Node(String p, int d, boolean loaded) { this.path = p; this.depth = d; this.alreadyLoaded = loaded; }
    }
}
