package com.elementhunter.core.crawler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.net.URI;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LinkNormalizer — href → same-host 정규 경로")
class LinkNormalizerTest {

    private static final URI BASE = URI.create("https://example.com/blog/post");

    @Nested
    @DisplayName("normalizePath")
    class NormalizePath {

        @Test
        @DisplayName("끝 슬래시 제거, 빈 경로는 /")
        void trimsTrailingSlashes() {
            assertThat(LinkNormalizer.normalizePath("/a/b/")).isEqualTo("/a/b");
            assertThat(LinkNormalizer.normalizePath("/a///")).isEqualTo("/a");
            assertThat(LinkNormalizer.normalizePath("")).isEqualTo("/");
            assertThat(LinkNormalizer.normalizePath("///")).isEqualTo("/");
            assertThat(LinkNormalizer.normalizePath("a")).isEqualTo("/a");
            assertThat(LinkNormalizer.normalizePath("//a")).isEqualTo("/a");
        }

        @Test
        @DisplayName("멱등: normalize(normalize(p)) == normalize(p)")
        void idempotent() {
            for (String p : List.of("", "/", "/a", "/a/", "a/b//", "//x//y/", "/%20x/", "/한글/")) {
                String once = LinkNormalizer.normalizePath(p);
                assertThat(LinkNormalizer.normalizePath(once)).as(p).isEqualTo(once);
            }
        }
    }

    @Test
    @DisplayName("javascript:, #, 타 호스트 → 링크 0개")
    void rejectsNonPageLinks() {
        Set<String> links = LinkNormalizer.normalizeLinks(
                List.of("javascript:void(0)", "#", "https://other.com/x"), BASE);
        assertThat(links).isEmpty();
    }

    @Test
    @DisplayName("mailto/tel/빈 값/대소문자 섞인 스킴도 제외")
    void rejectsSchemesCaseInsensitive() {
        Set<String> links = LinkNormalizer.normalizeLinks(
                List.of("mailto:a@b.c", "tel:010", "", "   ", "JavaScript:alert(1)", "#top"), BASE);
        assertThat(links).isEmpty();
    }

    @Test
    @DisplayName("상대 경로는 origin 기준, query/fragment 제거, 중복 제거, 문서 순서 유지")
    void resolvesAgainstOrigin() {
        Set<String> links = LinkNormalizer.normalizeLinks(List.of(
                "about/", "/contact?x=1#form", "https://EXAMPLE.com/about", "/", "./docs/a/"), BASE);
        assertThat(links).containsExactly("/about", "/contact", "/", "/docs/a");
    }

    @Test
    @DisplayName("잘못된 URL 은 조용히 버린다")
    void dropsMalformed() {
        assertThat(LinkNormalizer.normalizeLink("http://[bad", BASE)).isEmpty();
        assertThat(LinkNormalizer.normalizeLink("/has space", BASE)).contains("/has%20space");
    }

    @Nested
    @DisplayName("브라우저처럼 관대한 해석")
    class LenientResolution {

        @ParameterizedTest(name = "{0} → {1}")
        @CsvSource(delimiter = ' ', value = {
                "/search?q=a|b /search",
                "/p/{id} /p/%7Bid%7D",
                "/a^b /a%5Eb",
                "/50%off /50%25off",
                "/a%20b /a%20b",
                "/한글 /%ED%95%9C%EA%B8%80"
        })
        @DisplayName("URI 에 그대로 못 쓰는 문자도 버리지 않고 인코딩")
        void keepsLooseCharacters(String href, String expected) {
            assertThat(LinkNormalizer.normalizeLink(href, BASE)).contains(expected);
        }

        @Test
        @DisplayName("점 세그먼트 정리, 루트 위로는 못 올라간다")
        void collapsesDotSegments() {
            assertThat(LinkNormalizer.normalizeLink("../up", BASE)).contains("/up");
            assertThat(LinkNormalizer.normalizeLink("/../../up", BASE)).contains("/up");
            assertThat(LinkNormalizer.normalizeLink("https://example.com/a/../b", BASE)).contains("/b");
            assertThat(LinkNormalizer.normalizeLink("/a/./b/../c/", BASE)).contains("/a/c");
            assertThat(LinkNormalizer.normalizeLink("/..", BASE)).contains("/");
        }

        @Test
        @DisplayName("공백 인코딩 여부와 상관없이 같은 노드")
        void spaceFormsCollapse() {
            Set<String> links = LinkNormalizer.normalizeLinks(List.of("/a b", "/a%20b"), BASE);
            assertThat(links).containsExactly("/a%20b");
        }
    }
}
