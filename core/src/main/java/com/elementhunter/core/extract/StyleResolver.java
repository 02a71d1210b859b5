package com.elementhunter.core.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Evaluator;
import org.jsoup.select.QueryParser;
import org.jsoup.select.Selector;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 브라우저 computed style 의 근사치(정적 HTML 용).
 * - 우선순위: inline style > 문서 내 {@code <style>} 규칙(나중 규칙 우선, specificity 무시)
 * - color 는 상속, 링크는 UA 기본색(#0000ee), 루트 기본은 검정
 * - background-color 는 상속하지 않음(미지정 = transparent)
 * 외부 스타일시트는 읽지 않는다.
 */
final class StyleResolver {

    static final CssColor UA_LINK_COLOR = new CssColor(0, 0, 238);
    static final CssColor UA_TEXT_COLOR = new CssColor(0, 0, 0);

    private static final Pattern COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    // 가장 안쪽 블록만 — @media 래퍼는 자연히 벗겨진다
    private static final Pattern RULE = Pattern.compile("([^{}]+)\\{([^{}]*)\\}");
    private static final Pattern COLOR_TOKEN = Pattern.compile(
            "rgba?\\([^)]*\\)|#[0-9a-fA-F]{3,8}\\b|\\b[a-z]+\\b");
    // 상태/가상 요소 규칙은 정적 computed style 에 해당하지 않음
    private static final Pattern DYNAMIC_PSEUDO = Pattern.compile(
            ":(hover|focus|focus-within|focus-visible|active|visited|before|after|placeholder|selection|target)|::");

    private record Rule(Evaluator selector, Map<String, String> declarations) {}

    private final List<Rule> rules;
    private final Map<Element, Optional<CssColor>> colorCache = new IdentityHashMap<>();

    private StyleResolver(List<Rule> rules) {
        this.rules = rules;
    }

    static StyleResolver of(Document doc) {
        List<Rule> rules = new ArrayList<>();
        for (Element style : doc.select("style")) {
            String css = COMMENT.matcher(style.data()).replaceAll(" ");
            Matcher m = RULE.matcher(css);
            while (m.find()) {
                Map<String, String> decls = parseDeclarations(m.group(2));
                if (decls.isEmpty()) continue;
                for (String sel : m.group(1).split(",")) {
                    String s = sel.trim();
                    if (s.isEmpty() || s.startsWith("@") || DYNAMIC_PSEUDO.matcher(s).find()) continue;
                    try {
                        rules.add(new Rule(QueryParser.parse(s), decls));
                    } catch (Selector.SelectorParseException | IllegalArgumentException ignore) {
                        // jsoup 이 모르는 셀렉터는 건너뜀
                    }
                }
            }
        }
        return new StyleResolver(rules);
    }

    /** inline > 마지막으로 매칭된 규칙 */
    Optional<String> declared(Element el, String property) {
        Map<String, String> inline = parseDeclarations(el.attr("style"));
        if (inline.containsKey(property)) return Optional.of(inline.get(property));
        String found = null;
        for (Rule r : rules) {
            String v = r.declarations().get(property);
            if (v != null && el.is(r.selector())) found = v;
        }
        return Optional.ofNullable(found);
    }

    /** 비상속. 미지정/투명이면 empty */
    Optional<CssColor> backgroundColor(Element el) {
        Optional<String> bg = declared(el, "background-color");
        if (bg.isPresent()) return CssColor.parse(bg.get());
        return declared(el, "background").flatMap(StyleResolver::firstColor);
    }

    /** 상속 포함 글자색. 항상 값이 있다 */
    CssColor color(Element el) {
        return colorOf(el).orElse(UA_TEXT_COLOR);
    }

    private Optional<CssColor> colorOf(Element el) {
        if (el == null || el instanceof Document) return Optional.empty();
        Optional<CssColor> cached = colorCache.get(el);
        if (cached != null) return cached;

        Optional<CssColor> c = declared(el, "color").flatMap(CssColor::parse);
        if (c.isEmpty() && el.normalName().equals("a") && el.hasAttr("href")) {
            c = Optional.of(UA_LINK_COLOR);
        }
        if (c.isEmpty()) c = colorOf(el.parent());
        colorCache.put(el, c);
        return c;
    }

    static Optional<CssColor> firstColor(String shorthand) {
        Matcher m = COLOR_TOKEN.matcher(shorthand.toLowerCase(Locale.ROOT));
        while (m.find()) {
            Optional<CssColor> c = CssColor.parse(m.group());
            if (c.isPresent()) return c;
        }
        return Optional.empty();
    }

    static Map<String, String> parseDeclarations(String block) {
        Map<String, String> out = new LinkedHashMap<>();
        if (block == null || block.isBlank()) return out;
        for (String decl : block.split(";")) {
            int colon = decl.indexOf(':');
            if (colon <= 0) continue;
            String key = decl.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = decl.substring(colon + 1).trim();
            if (!key.isEmpty() && !value.isEmpty()) out.put(key, value);
        }
        return out;
    }
}
