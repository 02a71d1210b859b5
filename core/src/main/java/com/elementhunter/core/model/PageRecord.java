package com.elementhunter.core.model;

import java.util.List;
import java.util.Objects;

/**
 * 방문한 한 페이지의 추출 결과.
 * 생성 후에는 parentPath / estimatedWidth 만 덧붙여진다.
 */
public final class PageRecord {
    private final String path;
    private final int depth;
    private final String title;
    private final List<ElementSample> elements;
    private final int totalElementCount;
    private final List<String> links;        // 정규화된 same-host 경로(중복 없음)
    private final int contentLength;
    private final String textContent;        // 정제된 본문 발췌(≤2000자)
    private final List<String> imageUrls;    // 대표 이미지(≤5)
    private final String ogImage;            // nullable

    private String parentPath;               // 파생값(nullable)
    private Integer estimatedWidth;          // 파생값(분석 단계에서)

    public PageRecord(String path, int depth, ExtractedPage page, List<String> links) {
        this.path = Objects.requireNonNull(path, "path");
        this.depth = depth;
        Objects.requireNonNull(page, "page");
        this.title = page.title() == null ? "" : page.title();
        this.elements = List.copyOf(page.elements());
        this.totalElementCount = page.totalElementCount();
        this.links = List.copyOf(links);
        this.contentLength = page.contentLength();
        this.textContent = page.textContent() == null ? "" : page.textContent();
        this.imageUrls = List.copyOf(page.imageUrls());
        this.ogImage = page.ogImage();
    }

    public String getPath() { return path; }
    public int getDepth() { return depth; }
    public String getTitle() { return title; }
    public List<ElementSample> getElements() { return elements; }
    public int getTotalElementCount() { return totalElementCount; }
    public List<String> getLinks() { return links; }
    public int getContentLength() { return contentLength; }
    public String getTextContent() { return textContent; }
    public List<String> getImageUrls() { return imageUrls; }
    public String getOgImage() { return ogImage; }
    public String getParentPath() { return parentPath; }
    public Integer getEstimatedWidth() { return estimatedWidth; }

    public PageRecord attachParentPath(String parentPath) {
        this.parentPath = parentPath;
        return this;
    }

    public PageRecord attachEstimatedWidth(int estimatedWidth) {
        this.estimatedWidth = estimatedWidth;
        return this;
    }

    @Override
    public String toString() {
        return "PageRecord{" + path + ", depth=" + depth + ", elements=" + totalElementCount
                + ", links=" + links.size() + "}";
    }
}
