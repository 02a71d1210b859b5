package com.elementhunter.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 크롤 최종 산출물. 한 번 만들어지면 불변이며 {siteId}.json 으로 직렬화된다.
 * 필드명은 다운스트림 렌더러와의 호환 계약이다.
 */
@JsonPropertyOrder({"siteId", "siteName", "baseUrl", "metadata", "siteStyle", "pages",
        "deepestPages", "rareElements", "commonLinks", "elementStats"})
public record CrawlOutput(
        String siteId,
        String siteName,
        String baseUrl,
        CrawlMetadata metadata,
        SitePalette siteStyle,
        List<PageOutput> pages,
        List<String> deepestPages,
        List<String> rareElements,
        List<String> commonLinks,
        Map<String, ElementStat> elementStats) {

    public CrawlOutput {
        pages = List.copyOf(pages);
        deepestPages = List.copyOf(deepestPages);
        rareElements = List.copyOf(rareElements);
        commonLinks = List.copyOf(commonLinks);
        // 삽입 순서 유지(LinkedHashMap) + 읽기 전용
        elementStats = Collections.unmodifiableMap(new LinkedHashMap<>(elementStats));
    }
}
