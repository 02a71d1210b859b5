package com.elementhunter.core.model;

/**
 * 실행 메타데이터. crawlDuration 단위는 밀리초.
 *
 * @param maxDepth 관측된 최대 깊이(페이지가 없으면 0)
 */
public record CrawlMetadata(
        String crawledAt,
        String crawlerVersion,
        int totalPages,
        int totalElements,
        int maxDepth,
        long crawlDuration) {}
