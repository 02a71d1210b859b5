package com.elementhunter.core.model;

import java.util.List;

/**
 * 출력 JSON 의 pages[] 항목. links 에서는 공통 링크가 제거되어 있다.
 */
public record PageOutput(
        String path,
        int depth,
        String title,
        List<ElementSample> elements,
        int totalElementCount,
        List<String> links,
        String parentLink,
        int contentLength,
        int estimatedWidth,
        String textContent,
        List<String> imageUrls,
        String ogImage) {}
