package com.elementhunter.core.extract;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReadableContent — 본문 발췌 정제")
class ReadableContentTest {

    @Test
    @DisplayName("main 을 우선, nav/script/img/form 제거, 속성 제거, 허용 태그만")
    void cleansMain() {
        Document doc = Jsoup.parse("<body><nav>menu</nav>"
                + "<main class=\"x\"><h1 id=\"t\">Title</h1>"
                + "<p style=\"color:red\">Hello <a href=\"/x\">link</a> <strong>world</strong></p>"
                + "<script>evil()</script><img src=\"/a.jpg\"><form><input></form>"
                + "<section><p>In section</p></section></main></body>");

        String html = ReadableContent.extract(doc);

        assertThat(html).isEqualTo("<h1>Title</h1><p>Hello link <strong>world</strong></p><p>In section</p>");
        assertThat(doc.select("script")).hasSize(1); // 원본은 그대로
    }

    @Test
    @DisplayName("컨테이너가 없으면 body, 빈 태그는 중첩까지 제거")
    void fallsBackToBody() {
        Document doc = Jsoup.parse("<body><header>h</header><div><span> </span></div><p>text</p><footer>f</footer></body>");
        assertThat(ReadableContent.extract(doc)).isEqualTo("<p>text</p>");
    }

    @Test
    @DisplayName("2000자를 넘지 않고 잘린 태그 조각을 남기지 않는다")
    void truncates() {
        StringBuilder sb = new StringBuilder("<body><article>");
        for (int i = 0; i < 300; i++) sb.append("<p>paragraph ").append(i).append("</p>");
        Document doc = Jsoup.parse(sb.append("</article></body>").toString());

        String html = ReadableContent.extract(doc);
        assertThat(html.length()).isLessThanOrEqualTo(ReadableContent.MAX_LENGTH);
        assertThat(html.lastIndexOf('<')).isLessThan(html.lastIndexOf('>'));
    }

    @Test
    @DisplayName("truncate: 열린 태그 조각은 버린다")
    void truncateDropsPartialTag() {
        String s = "x".repeat(1995) + "<strong>abc";
        assertThat(ReadableContent.truncate(s)).isEqualTo("x".repeat(1995));
    }
}
