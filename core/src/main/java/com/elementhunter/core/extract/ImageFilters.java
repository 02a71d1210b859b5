package com.elementhunter.core.extract;

import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 이미지 필터 두 가지(서로 독립).
 * - 샘플 필터: img 태그 집계용, 장식/아이콘류를 강하게 거른다
 * - 대표 이미지 후보: 본문 표시용, 아이콘/로고만 거른다
 */
public final class ImageFilters {
    private ImageFilters() {}

    static final List<String> DECORATIVE_KEYWORDS = List.of(
            "icon", "logo", "favicon", "button", "arrow", "close", "chevron", "caret",
            "spinner", "loading", "spacer", "placeholder", "blank", "pixel", "transparent", "badge");

    static final List<String> SHORTLIST_REJECT = List.of("icon", "logo", "favicon");

    static final int SAMPLE_MIN_DIMENSION = 100;
    static final double SAMPLE_MAX_ASPECT = 5.0;
    static final int SHORTLIST_MIN_DIMENSION = 50;
    public static final int SHORTLIST_MAX = 5;

    private static final Pattern LEADING_INT = Pattern.compile("^\\s*(\\d+)");

    /** img 샘플로 받을지 */
    public static boolean acceptSample(Element img) {
        String src = img.attr("src").trim();
        if (src.isEmpty()) return false;
        String lower = src.toLowerCase(Locale.ROOT);
        if (lower.startsWith("data:")) return false;
        for (String k : DECORATIVE_KEYWORDS) {
            if (lower.contains(k)) return false;
        }
        if (pathOf(lower).endsWith(".svg")) return false;

        OptionalInt w = declaredDimension(img, "width");
        OptionalInt h = declaredDimension(img, "height");
        if (w.isPresent() && w.getAsInt() < SAMPLE_MIN_DIMENSION) return false;
        if (h.isPresent() && h.getAsInt() < SAMPLE_MIN_DIMENSION) return false;
        if (w.isPresent() && h.isPresent() && w.getAsInt() > 0 && h.getAsInt() > 0) {
            double ratio = Math.max(w.getAsInt(), h.getAsInt()) / (double) Math.min(w.getAsInt(), h.getAsInt());
            if (ratio > SAMPLE_MAX_ASPECT) return false;
        }
        return true;
    }

    /** 대표 이미지 후보로 받을지(선언된 크기만 본다) */
    public static boolean acceptShortlist(Element img) {
        String src = img.attr("src").trim();
        if (src.isEmpty()) return false;
        String lower = src.toLowerCase(Locale.ROOT);
        for (String k : SHORTLIST_REJECT) {
            if (lower.contains(k)) return false;
        }
        OptionalInt w = declaredDimension(img, "width");
        OptionalInt h = declaredDimension(img, "height");
        if (w.isPresent() && w.getAsInt() < SHORTLIST_MIN_DIMENSION) return false;
        return h.isEmpty() || h.getAsInt() >= SHORTLIST_MIN_DIMENSION;
    }

    /**
     * width/height 속성의 선행 정수("300", "300px"). "100%" 같은 상대값과 비숫자는 미선언 취급.
     */
    static OptionalInt declaredDimension(Element img, String attr) {
        String v = img.attr(attr).trim();
        if (v.isEmpty() || v.endsWith("%")) return OptionalInt.empty();
        Matcher m = LEADING_INT.matcher(v);
        if (!m.find()) return OptionalInt.empty();
        try {
            return OptionalInt.of(Integer.parseInt(m.group(1)));
        } catch (NumberFormatException e) {
            // 자릿수 초과: 충분히 크다
            return OptionalInt.of(Integer.MAX_VALUE);
        }
    }

    private static String pathOf(String url) {
        int cut = url.length();
        int q = url.indexOf('?');
        int f = url.indexOf('#');
        if (q >= 0) cut = Math.min(cut, q);
        if (f >= 0) cut = Math.min(cut, f);
        return url.substring(0, cut);
    }
}
