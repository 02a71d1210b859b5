package com.elementhunter.core.crawler;

import com.elementhunter.core.model.CrawlConfig;
import com.elementhunter.core.model.PageRecord;
import com.elementhunter.core.util.UrlUtils;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 크롤 1회 동안의 가변 상태. 크롤 시작 시 만들어지고 단일 탐색 태스크만 만진다(락 불필요).
 */
public final class CrawlContext {
    private final CrawlConfig config;
    private final URI baseUrl;                              // origin
    private final Instant startedAt;
    private final Set<String> visited = new LinkedHashSet<>(); // 꺼낸 시점에 추가, 줄지 않음
    private final List<PageRecord> pages = new ArrayList<>();
    private int extractionSeq = 0;

    public CrawlContext(CrawlConfig config, Instant startedAt) {
        this.config = Objects.requireNonNull(config, "config");
        this.baseUrl = UrlUtils.origin(config.targetUri());
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
    }

    public CrawlConfig config() { return config; }
    public URI baseUrl() { return baseUrl; }
    public Instant startedAt() { return startedAt; }

    public boolean isVisited(String path) { return visited.contains(path); }
    public boolean markVisited(String path) { return visited.add(path); }
    public Set<String> visited() { return Collections.unmodifiableSet(visited); }

    public void addPage(PageRecord page) { pages.add(page); }
    public int pageCount() { return pages.size(); }
    public List<PageRecord> pages() { return Collections.unmodifiableList(pages); }

    /** 추출 호출 일련번호(크롤마다 1부터) */
    public int nextExtractionId() { return ++extractionSeq; }

    /** 정규 경로 → 절대 URL */
    public URI urlFor(String path) {
        return URI.create(UrlUtils.originString(baseUrl) + path);
    }

    /**
     * 마지막 세그먼트를 떼어낸 경로가 지금까지 기록된 페이지 중에 있으면 그 경로, 없으면 null.
     * DFS 순서상 먼저 발견된 쪽이 부모가 된다.
     */
    public String findParentPath(String path) {
        List<String> segments = new ArrayList<>();
        for (String s : path.split("/")) {
            if (!s.isEmpty()) segments.add(s);
        }
        if (segments.isEmpty()) return null;

        segments.remove(segments.size() - 1);
        String parent = segments.isEmpty() ? "/" : "/" + String.join("/", segments);
        for (PageRecord p : pages) {
            if (p.getPath().equals(parent)) return p.getPath();
        }
        return null;
    }
}
