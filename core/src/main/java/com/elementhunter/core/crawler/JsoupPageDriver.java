package com.elementhunter.core.crawler;

import com.elementhunter.core.api.ExtractionScript;
import com.elementhunter.core.api.PageDriver;
import com.elementhunter.core.model.CrawlConfig;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * 기본 JSoup 기반 드라이버: GET → 정적 HTML 파싱.
 * 스크립트 실행/렌더링은 하지 않으므로 "network idle" 은 응답 본문 수신 완료로 본다.
 */
public class JsoupPageDriver implements PageDriver {
    private static final Logger LOG = LoggerFactory.getLogger(JsoupPageDriver.class);

    private final String userAgent;
    private final boolean followRedirects;
    private int timeoutMs;
    private Document current;

    public JsoupPageDriver(CrawlConfig config) {
        this(config.getTimeoutMs(), config.getUserAgent(), true);
    }

    public JsoupPageDriver(long timeoutMs, String userAgent, boolean followRedirects) {
        this.timeoutMs = clamp(timeoutMs);
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
        this.followRedirects = followRedirects;
    }

    @Override
    public void navigate(URI url) throws IOException {
        Objects.requireNonNull(url, "url");
        current = null;
        LOG.debug("GET {} (timeout={}ms)", url, timeoutMs);
        current = Jsoup.connect(url.toString())
                .userAgent(userAgent)
                .timeout(timeoutMs)
                .followRedirects(followRedirects)
                .get();
    }

    @Override
    public <T> T evaluate(ExtractionScript<T> script) {
        Objects.requireNonNull(script, "script");
        if (current == null) throw new IllegalStateException("no page loaded");
        return script.evaluate(current);
    }

    @Override
    public void setTimeout(Duration timeout) {
        if (timeout != null) this.timeoutMs = clamp(timeout.toMillis());
    }

    int getTimeoutMs() { return timeoutMs; }

    @Override
    public void close() {
        current = null;
    }

    // jsoup timeout은 int 필요 → 안전 캐스팅
    private static int clamp(long ms) {
        return (int) Math.max(0, Math.min(Integer.MAX_VALUE, ms));
    }
}
