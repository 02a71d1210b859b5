package com.elementhunter.core.analyzer;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 태그별 기본 희귀도 티어(1~5). 표에 없는 태그는 1.
 */
public final class RarityTable {
    private RarityTable() {}

    public static final int MIN_TIER = 1;
    public static final int MAX_TIER = 5;

    private static final Map<String, Integer> BASE = new HashMap<>();

    static {
        tier(1, "p", "span", "div", "a", "li", "img", "ul", "ol", "br", "hr", "em", "strong");
        tier(2, "h6", "h5", "h4", "table", "form", "button", "input", "select", "textarea", "label", "tr", "td");
        tier(3, "h3", "h2", "h1", "article", "section", "video", "audio", "canvas", "iframe", "nav", "aside");
        tier(4, "dialog", "template", "details", "meter", "progress", "svg", "picture", "mark", "summary");
        tier(5, "ruby", "bdo", "wbr", "data", "slot", "output", "math", "object", "embed");
    }

    private static void tier(int t, String... tags) {
        for (String tag : tags) BASE.put(tag, t);
    }

    public static int baseRarity(String tag) {
        if (tag == null) return MIN_TIER;
        return BASE.getOrDefault(tag.toLowerCase(Locale.ROOT), MIN_TIER);
    }

    /**
     * 기본 티어와 출현 비율 하한 중 큰 값.
     * 비율 &lt; 0.1 → 4, &lt; 0.3 → 3, &lt; 0.5 → 2.
     */
    public static int effectiveRarity(String tag, int pageCount, int totalPages) {
        int base = baseRarity(tag);
        if (totalPages <= 0) return base;
        double rate = pageCount / (double) totalPages;
        if (rate < 0.1) return Math.max(base, 4);
        if (rate < 0.3) return Math.max(base, 3);
        if (rate < 0.5) return Math.max(base, 2);
        return base;
    }
}
