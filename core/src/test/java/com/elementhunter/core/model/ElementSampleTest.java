package com.elementhunter.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ElementSampleTest {

    @Test
    @DisplayName("img 는 이미지 URL 만, 다른 태그는 텍스트만")
    void exclusiveSamples() {
        ElementSample img = ElementSample.ofImages(2, List.of("https://x/a.jpg"));
        assertThat(img.sampleTexts()).isEmpty();
        assertThat(img.sampleImageUrls()).containsExactly("https://x/a.jpg");

        ElementSample p = ElementSample.ofTexts("p", 1, List.of("hello"));
        assertThat(p.sampleImageUrls()).isNull();

        assertThatThrownBy(() -> new ElementSample("p", 1, List.of(), List.of("x")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ElementSample("img", 1, List.of("t"), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
