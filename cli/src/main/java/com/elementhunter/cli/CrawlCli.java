package com.elementhunter.cli;

import com.elementhunter.cli.logging.LogSetup;
import com.elementhunter.core.analyzer.CrawlOutputBuilder;
import com.elementhunter.core.model.CrawlConfig;
import com.elementhunter.core.model.CrawlOutput;
import com.elementhunter.core.service.CrawlService;
import com.elementhunter.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * eh-crawl 진입점.
 * 종료 코드: 0 성공 / 1 설정·실행 오류 / 2 사용법 오류
 */
public final class CrawlCli {
    private static final Logger LOG = LoggerFactory.getLogger(CrawlCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final String RULE = "━".repeat(50);

    private final PrintStream out;
    private final PrintStream err;
    private final Function<CrawlConfig, CrawlService> serviceFactory;

    CrawlCli(PrintStream out, PrintStream err, Function<CrawlConfig, CrawlService> serviceFactory) {
        this.out = out;
        this.err = err;
        this.serviceFactory = serviceFactory;
    }

    public static void main(String[] args) {
        int code = new CrawlCli(System.out, System.err, CrawlService::new).run(args);
        System.exit(code);
    }

    int run(String[] args) {
        CliArgs cli;
        try {
            cli = CliArgs.parse(args);
        } catch (CliArgs.UsageException e) {
            err.println("Error: " + e.getMessage());
            err.println(CliArgs.USAGE);
            return EXIT_USAGE;
        }
        if (cli.help) {
            out.println(CliArgs.USAGE);
            return EXIT_OK;
        }
        if (cli.version) {
            out.println(CrawlOutputBuilder.CRAWLER_VERSION);
            return EXIT_OK;
        }

        CrawlConfig base;
        try {
            base = (cli.config != null) ? YamlConfigLoader.load(cli.config) : CrawlConfig.defaults();
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
        CrawlConfig cfg = cli.applyTo(base);
        if (cfg.getTarget() == null) {
            err.println("Error: missing <url>");
            err.println(CliArgs.USAGE);
            return EXIT_USAGE;
        }

        LogSetup.init(cfg.isVerbose());

        CrawlService service;
        try {
            cfg.validate();
            service = serviceFactory.apply(cfg);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }

        printHeader(cfg);
        try {
            CrawlService.Result result = service.runAndExport((phase, p, done, total) ->
                    LOG.debug("{} {}/{}", phase, done, total));
            printSummary(result);
            return EXIT_OK;
        } catch (IOException | RuntimeException e) {
            LOG.error("Crawl failed", e);
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private void printHeader(CrawlConfig cfg) {
        out.println("Element Hunter Crawler v" + CrawlOutputBuilder.CRAWLER_VERSION);
        out.println(RULE);
        out.println("Target: " + cfg.getTarget());
        out.println("Max Depth: " + cfg.getMaxDepth());
        out.println("Max Pages: " + cfg.getMaxPages());
        out.println(RULE);
    }

    void printSummary(CrawlService.Result result) {
        CrawlOutput o = result.output();
        List<String> deepest = o.deepestPages().subList(0, Math.min(3, o.deepestPages().size()));
        String rare = o.rareElements().isEmpty() ? "none" : String.join(", ", o.rareElements());

        out.println(RULE);
        out.println("Results:");
        out.println("  Pages crawled: " + o.metadata().totalPages());
        out.println("  Total elements: " + o.metadata().totalElements());
        out.println("  Common links: " + o.commonLinks().size() + " (excluded)");
        out.println("  Rare elements: " + rare);
        out.println("  Deepest pages: " + String.join(", ", deepest));
        out.println(String.format(Locale.ROOT, "  Duration: %.1fs", o.metadata().crawlDuration() / 1000.0));
        out.println();
        out.println("Output: " + result.file());
        out.println(RULE);
    }
}
