package com.elementhunter.core.service;

import com.elementhunter.core.api.PageDriver;
import com.elementhunter.core.crawler.Crawler;
import com.elementhunter.core.crawler.JsoupPageDriver;
import com.elementhunter.core.model.CrawlConfig;
import com.elementhunter.core.model.CrawlOutput;
import com.elementhunter.core.service.export.JsonSiteExporter;
import com.elementhunter.core.service.export.SiteExporter;
import com.elementhunter.core.util.ProgressListener;
import com.elementhunter.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;

/**
 * 크롤 오케스트레이터:
 *  - crawl → analyze(빌더) → export
 *  - 드라이버는 실행마다 팩토리로 만들고 끝나면 닫는다
 *  - DI 생성자는 테스트용
 */
public final class CrawlService {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlService.class);
    private static final StructuredLog SLOG = StructuredLog.get(CrawlService.class);

    private final CrawlConfig config;
    private final Function<CrawlConfig, PageDriver> driverFactory;
    private final Function<PageDriver, Crawler> crawlerFactory;
    private final SiteExporter exporter;

    /** 기본 구현(jsoup 드라이버 + JSON exporter) */
    public CrawlService(CrawlConfig config) {
        this(config, JsoupPageDriver::new, Crawler::new, new JsonSiteExporter());
    }

    /** DI/테스트용 */
    public CrawlService(CrawlConfig config,
                        Function<CrawlConfig, PageDriver> driverFactory,
                        Function<PageDriver, Crawler> crawlerFactory,
                        SiteExporter exporter) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.driverFactory = Objects.requireNonNull(driverFactory, "driverFactory");
        this.crawlerFactory = Objects.requireNonNull(crawlerFactory, "crawlerFactory");
        this.exporter = Objects.requireNonNull(exporter, "exporter");
    }

    public CrawlConfig getConfig() { return config; }

    public CrawlOutput run() {
        return run(ProgressListener.NONE);
    }

    public CrawlOutput run(ProgressListener listener) {
        ProgressListener pl = (listener == null) ? ProgressListener.NONE : listener;
        LOG.info("Crawling {} (maxDepth={}, maxPages={})",
                config.getTarget(), config.getMaxDepth(), config.getMaxPages());
        try (PageDriver driver = driverFactory.apply(config)) {
            CrawlOutput out = crawlerFactory.apply(driver).withProgress(pl).crawl(config);
            pl.onProgress(ProgressListener.Phase.ANALYZE, 1.0, out.pages().size(), out.pages().size());
            return out;
        }
    }

    /** 산출물을 config.outputDir 아래에 쓴다 */
    public Path export(CrawlOutput output) throws IOException {
        Path file = exporter.export(config.getOutputDir(), output);
        SLOG.info("export-done", "file", file.toString(), "pages", output.pages().size());
        return file;
    }

    public Result runAndExport(ProgressListener listener) throws IOException {
        ProgressListener pl = (listener == null) ? ProgressListener.NONE : listener;
        CrawlOutput out = run(pl);
        Path file = export(out);
        pl.onProgress(ProgressListener.Phase.EXPORT, 1.0, 1, 1);
        return new Result(out, file);
    }

    public record Result(CrawlOutput output, Path file) {}
}
