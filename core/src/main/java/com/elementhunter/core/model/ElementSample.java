package com.elementhunter.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * 한 페이지 안에서의 태그별 집계.
 * img 는 이미지 URL만, 나머지 태그는 텍스트 샘플만 가진다.
 *
 * @param tag             소문자 태그명
 * @param count           해당 페이지에서의 출현 수
 * @param sampleTexts     고유 텍스트 샘플(최대 30개, img 이면 빈 리스트)
 * @param sampleImageUrls 고유 이미지 URL(최대 30개, img 가 아니면 null → JSON 에서 생략)
 */
public record ElementSample(
        String tag,
        int count,
        List<String> sampleTexts,
        @JsonInclude(JsonInclude.Include.NON_NULL) List<String> sampleImageUrls) {

    public static final int MAX_SAMPLES = 30;
    public static final String IMG = "img";

    public ElementSample {
        Objects.requireNonNull(tag, "tag");
        sampleTexts = (sampleTexts == null) ? List.of() : List.copyOf(sampleTexts);
        sampleImageUrls = (sampleImageUrls == null) ? null : List.copyOf(sampleImageUrls);
        if (IMG.equals(tag)) {
            if (!sampleTexts.isEmpty()) throw new IllegalArgumentException("img must not carry text samples");
            if (sampleImageUrls == null) sampleImageUrls = List.of();
        } else if (sampleImageUrls != null) {
            throw new IllegalArgumentException("only img carries image samples: " + tag);
        }
    }

    public static ElementSample ofTexts(String tag, int count, List<String> texts) {
        return new ElementSample(tag, count, texts, null);
    }

    public static ElementSample ofImages(int count, List<String> urls) {
        return new ElementSample(IMG, count, List.of(), urls);
    }
}
