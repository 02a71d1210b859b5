package com.elementhunter.core.model;

import java.util.List;

/**
 * 페이지 추출기 결과(경로/깊이는 아직 없음). links 는 정규화 전 원본 href.
 */
public record ExtractedPage(
        String title,
        List<ElementSample> elements,
        int totalElementCount,
        List<String> rawLinks,
        int contentLength,
        String textContent,
        List<String> imageUrls,
        String ogImage) {

    public ExtractedPage {
        elements = (elements == null) ? List.of() : List.copyOf(elements);
        rawLinks = (rawLinks == null) ? List.of() : List.copyOf(rawLinks);
        imageUrls = (imageUrls == null) ? List.of() : List.copyOf(imageUrls);
    }
}
