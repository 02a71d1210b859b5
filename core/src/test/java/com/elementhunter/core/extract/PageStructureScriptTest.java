package com.elementhunter.core.extract;

import com.elementhunter.core.model.ElementSample;
import com.elementhunter.core.model.ExtractedPage;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PageStructureScript — 태그 집계/샘플/본문/이미지")
class PageStructureScriptTest {

    private static ExtractedPage run(String html) {
        Document doc = Jsoup.parse(html, "https://example.com/blog/post");
        return new PageStructureScript().evaluate(doc);
    }

    private static Optional<ElementSample> tag(ExtractedPage page, String tag) {
        return page.elements().stream().filter(e -> e.tag().equals(tag)).findFirst();
    }

    @Nested
    @DisplayName("태그 집계")
    class Census {

        @Test
        @DisplayName("script/style/meta/link/noscript 는 세지 않고, 출현 수 내림차순")
        void countsAndSkips() {
            ExtractedPage page = run("<html><head><title>T</title><meta charset=utf-8>"
                    + "<link rel=stylesheet href=a.css><style>p{}</style><script>x()</script></head>"
                    + "<body><noscript>n</noscript><p>one</p><p>two</p><p>three</p><div>box</div></body></html>");

            assertThat(page.elements()).extracting(ElementSample::tag)
                    .doesNotContain("script", "style", "meta", "link", "noscript");
            assertThat(page.elements().get(0).tag()).isEqualTo("p");
            assertThat(tag(page, "p")).get().extracting(ElementSample::count).isEqualTo(3);
            // html, head, title, body, p×3, div
            assertThat(page.totalElementCount()).isEqualTo(8);
            assertThat(page.title()).isEqualTo("T");
        }

        @Test
        @DisplayName("텍스트 샘플: 자기 텍스트만, 공백 정리, 3자 미만 제외, 중복 제거")
        void textSamples() {
            ExtractedPage page = run("<body><p>  hello\n   world <b>bold text</b></p>"
                    + "<p>hi</p><p>hello world</p></body>");

            ElementSample p = tag(page, "p").orElseThrow();
            assertThat(p.sampleTexts()).containsExactly("hello world");
            assertThat(p.sampleImageUrls()).isNull();
            assertThat(tag(page, "b").orElseThrow().sampleTexts()).containsExactly("bold text");
        }

        @Test
        @DisplayName("50자 초과 텍스트는 49자 + … 로 자른다")
        void truncatesLongText() {
            String longText = "a".repeat(80);
            ExtractedPage page = run("<body><p>" + longText + "</p></body>");

            String sample = tag(page, "p").orElseThrow().sampleTexts().get(0);
            assertThat(sample).hasSize(50).endsWith("…").startsWith("a".repeat(49));
        }

        @Test
        @DisplayName("샘플은 태그당 최대 30개")
        void capsSamples() {
            StringBuilder sb = new StringBuilder("<body>");
            for (int i = 0; i < 40; i++) sb.append("<li>item number ").append(i).append("</li>");
            ExtractedPage page = run(sb.append("</body>").toString());

            ElementSample li = tag(page, "li").orElseThrow();
            assertThat(li.count()).isEqualTo(40);
            assertThat(li.sampleTexts()).hasSize(ElementSample.MAX_SAMPLES);
        }

        @Test
        @DisplayName("img: 장식용 svg 는 빼고 큰 사진만 샘플로")
        void imageSamples() {
            ExtractedPage page = run("<body>"
                    + "<img src=\"/logo-small.svg\">"
                    + "<img src=\"/photo.jpg\" width=\"400\" height=\"300\">"
                    + "</body>");

            ElementSample img = tag(page, "img").orElseThrow();
            assertThat(img.count()).isEqualTo(2);
            assertThat(img.sampleTexts()).isEmpty();
            assertThat(img.sampleImageUrls()).containsExactly("/photo.jpg");
        }
    }

    @Test
    @DisplayName("링크는 a[href] 원본 그대로 문서 순서")
    void rawLinks() {
        ExtractedPage page = run("<body><a href=\"/x\">x</a><a>no</a><a href=\"#\">top</a>"
                + "<a href=\"https://other.com\">o</a></body>");
        assertThat(page.rawLinks()).containsExactly("/x", "#", "https://other.com");
    }

    @Test
    @DisplayName("대표 이미지: 아이콘/로고/작은 이미지 제외, 최대 5개")
    void shortlist() {
        StringBuilder sb = new StringBuilder("<body>")
                .append("<img src=\"/favicon.png\">")
                .append("<img src=\"/brand-logo.png\" width=\"300\">")
                .append("<img src=\"/tiny.png\" width=\"20\" height=\"20\">");
        for (int i = 1; i <= 7; i++) sb.append("<img src=\"/p").append(i).append(".jpg\">");
        ExtractedPage page = run(sb.append("</body>").toString());

        assertThat(page.imageUrls()).containsExactly("/p1.jpg", "/p2.jpg", "/p3.jpg", "/p4.jpg", "/p5.jpg");
    }

    @Test
    @DisplayName("og:image 가 없으면 null")
    void ogImage() {
        assertThat(run("<head><meta property=\"og:image\" content=\"/og.png\"></head>").ogImage())
                .isEqualTo("/og.png");
        assertThat(run("<body></body>").ogImage()).isNull();
    }

    @Test
    @DisplayName("contentLength = body 텍스트 길이")
    void contentLength() {
        ExtractedPage page = run("<body><p>abc</p><p>de</p></body>");
        assertThat(page.contentLength()).isEqualTo(5);
    }
}
