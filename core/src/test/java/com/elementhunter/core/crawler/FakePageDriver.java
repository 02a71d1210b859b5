package com.elementhunter.core.crawler;

import com.elementhunter.core.api.ExtractionScript;
import com.elementhunter.core.api.PageDriver;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** 경로 → HTML 맵 기반 드라이버. 네트워크 없이 크롤러를 돌린다 */
final class FakePageDriver implements PageDriver {
    private final Map<String, String> pages = new HashMap<>();
    private final Set<String> failing = new HashSet<>();
    final List<String> navigations = new ArrayList<>();
    Duration timeout;
    private Document current;

    FakePageDriver page(String path, String html) {
        pages.put(path, html);
        return this;
    }

    /** body 에 링크만 있는 페이지 */
    FakePageDriver links(String path, String... hrefs) {
        StringBuilder sb = new StringBuilder("<html><head><title>").append(path)
                .append("</title></head><body>");
        for (String h : hrefs) sb.append("<a href=\"").append(h).append("\">").append(h).append("</a>");
        return page(path, sb.append("</body></html>").toString());
    }

    FakePageDriver failing(String path) {
        failing.add(path);
        return this;
    }

    @Override
    public void navigate(URI url) throws IOException {
        current = null;
        String path = url.getRawPath() == null || url.getRawPath().isEmpty() ? "/" : url.getRawPath();
        navigations.add(path);
        if (failing.contains(path)) throw new IOException("boom: " + path);
        String html = pages.get(path);
        if (html == null) throw new IOException("404: " + path);
        current = Jsoup.parse(html, url.toString());
    }

    @Override
    public <T> T evaluate(ExtractionScript<T> script) {
        if (current == null) throw new IllegalStateException("no page loaded");
        return script.evaluate(current);
    }

    @Override
    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }
}
