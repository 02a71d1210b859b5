package com.elementhunter.core.extract;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.safety.Safelist;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 본문 발췌(정제된 HTML 조각, 최대 2000자).
 * 원본 문서는 건드리지 않고 분리된 사본에서 작업한다.
 */
final class ReadableContent {
    private ReadableContent() {}

    static final int MAX_LENGTH = 2000;

    static final List<String> CONTAINERS = List.of(
            "main", "article", ".content", "#main", "#content", ".main-content");

    static final String STRIPPED = "style, script, noscript, svg, iframe, img, video, audio, canvas, "
            + "form, input, button, nav, header, footer, aside";

    static final String[] ALLOWED_TAGS = {
            "p", "div", "span", "h1", "h2", "h3", "h4", "h5", "h6",
            "ul", "ol", "li", "strong", "em", "b", "i", "br"};

    private static final Pattern WS = Pattern.compile("\\s+");
    private static final Pattern EMPTY_TAG = Pattern.compile(
            "<(p|div|span|h[1-6]|ul|ol|li|strong|em|b|i)>\\s*</\\1>");

    static String extract(Document doc) {
        Element container = pickContainer(doc);
        if (container == null) return "";

        Element copy = container.clone();
        copy.select(STRIPPED).remove();

        Document.OutputSettings out = new Document.OutputSettings().prettyPrint(false);
        String html = Jsoup.clean(copy.html(), "", Safelist.none().addTags(ALLOWED_TAGS), out);
        html = WS.matcher(html).replaceAll(" ").trim();

        // 비운 태그가 다시 빈 부모를 만들 수 있으므로 변화가 없을 때까지
        String prev;
        do {
            prev = html;
            html = EMPTY_TAG.matcher(html).replaceAll("");
        } while (!html.equals(prev));
        html = WS.matcher(html).replaceAll(" ").trim();

        return truncate(html);
    }

    static Element pickContainer(Document doc) {
        for (String sel : CONTAINERS) {
            Element el = doc.selectFirst(sel);
            if (el != null) return el;
        }
        return doc.body();
    }

    /** 2000자 초과분을 자르고, 잘린 태그 조각(마지막 '<' 이후 '>' 없음)은 버린다 */
    static String truncate(String html) {
        if (html.length() <= MAX_LENGTH) return html;
        String cut = html.substring(0, MAX_LENGTH);
        int lt = cut.lastIndexOf('<');
        if (lt >= 0 && cut.indexOf('>', lt) < 0) cut = cut.substring(0, lt);
        return cut;
    }
}
