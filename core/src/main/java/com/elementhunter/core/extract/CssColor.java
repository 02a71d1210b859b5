package com.elementhunter.core.extract;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CSS 색상 값(불투명 RGB). transparent / alpha 0 은 파싱 결과가 비어 있다.
 */
public record CssColor(int r, int g, int b) {

    private static final Pattern HEX = Pattern.compile("#([0-9a-fA-F]{3,4}|[0-9a-fA-F]{6}|[0-9a-fA-F]{8})");
    private static final Pattern RGB = Pattern.compile(
            "rgba?\\(\\s*([\\d.]+%?)\\s*[, ]\\s*([\\d.]+%?)\\s*[, ]\\s*([\\d.]+%?)\\s*(?:[,/]\\s*([\\d.]+%?)\\s*)?\\)");

    // 자주 쓰이는 이름만
    private static final Map<String, CssColor> NAMED = Map.ofEntries(
            Map.entry("white", new CssColor(255, 255, 255)),
            Map.entry("black", new CssColor(0, 0, 0)),
            Map.entry("red", new CssColor(255, 0, 0)),
            Map.entry("green", new CssColor(0, 128, 0)),
            Map.entry("blue", new CssColor(0, 0, 255)),
            Map.entry("navy", new CssColor(0, 0, 128)),
            Map.entry("teal", new CssColor(0, 128, 128)),
            Map.entry("purple", new CssColor(128, 0, 128)),
            Map.entry("orange", new CssColor(255, 165, 0)),
            Map.entry("yellow", new CssColor(255, 255, 0)),
            Map.entry("gold", new CssColor(255, 215, 0)),
            Map.entry("crimson", new CssColor(220, 20, 60)),
            Map.entry("tomato", new CssColor(255, 99, 71)),
            Map.entry("royalblue", new CssColor(65, 105, 225)),
            Map.entry("dodgerblue", new CssColor(30, 144, 255)),
            Map.entry("gray", new CssColor(128, 128, 128)),
            Map.entry("grey", new CssColor(128, 128, 128)),
            Map.entry("silver", new CssColor(192, 192, 192)),
            Map.entry("whitesmoke", new CssColor(245, 245, 245)));

    public CssColor {
        r = clamp(r); g = clamp(g); b = clamp(b);
    }

    /**
     * CSS 색상 문자열 파싱. 지원하지 않는 형식/transparent 는 empty.
     */
    public static Optional<CssColor> parse(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim().toLowerCase(Locale.ROOT);
        int bang = v.indexOf('!');
        if (bang >= 0) v = v.substring(0, bang).trim(); // !important
        if (v.isEmpty() || v.equals("transparent") || v.equals("inherit") || v.equals("initial")) {
            return Optional.empty();
        }

        Matcher hex = HEX.matcher(v);
        if (hex.matches()) return fromHex(hex.group(1));

        Matcher rgb = RGB.matcher(v);
        if (rgb.matches()) {
            try {
                if (rgb.group(4) != null && channel(rgb.group(4), 1.0) <= 0.0) return Optional.empty();
                return Optional.of(new CssColor(
                        (int) Math.round(channel(rgb.group(1), 255.0)),
                        (int) Math.round(channel(rgb.group(2), 255.0)),
                        (int) Math.round(channel(rgb.group(3), 255.0))));
            } catch (NumberFormatException e) {
                // "1.2.3", "." 처럼 정규식은 통과하지만 숫자가 아닌 토큰
                return Optional.empty();
            }
        }
        return Optional.ofNullable(NAMED.get(v));
    }

    /** #rrggbb (소문자) */
    public String toHex() {
        return String.format(Locale.ROOT, "#%02x%02x%02x", r, g, b);
    }

    /** max-min 채널 차이가 30 미만이면 무채색 취급 */
    public boolean isNeutral() {
        int max = Math.max(r, Math.max(g, b));
        int min = Math.min(r, Math.min(g, b));
        return max - min < 30;
    }

    /** HSL 채도(0~1) */
    public double saturation() {
        double max = Math.max(r, Math.max(g, b)) / 255.0;
        double min = Math.min(r, Math.min(g, b)) / 255.0;
        double d = max - min;
        if (d == 0.0) return 0.0;
        double l = (max + min) / 2.0;
        return d / (1.0 - Math.abs(2.0 * l - 1.0));
    }

    /** #rgb / #rrggbb 형태의 theme-color 를 #rrggbb 로. 형식이 아니면 empty */
    public static Optional<String> normalizeHex(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim();
        if (!v.matches("#([0-9a-fA-F]{3}|[0-9a-fA-F]{6})")) return Optional.empty();
        return fromHex(v.substring(1)).map(CssColor::toHex);
    }

    private static Optional<CssColor> fromHex(String h) {
        if (h.length() == 3 || h.length() == 4) {
            if (h.length() == 4 && h.charAt(3) == '0') return Optional.empty();
            int r = Integer.parseInt("" + h.charAt(0) + h.charAt(0), 16);
            int g = Integer.parseInt("" + h.charAt(1) + h.charAt(1), 16);
            int b = Integer.parseInt("" + h.charAt(2) + h.charAt(2), 16);
            return Optional.of(new CssColor(r, g, b));
        }
        if (h.length() == 8 && h.endsWith("00")) return Optional.empty();
        return Optional.of(new CssColor(
                Integer.parseInt(h.substring(0, 2), 16),
                Integer.parseInt(h.substring(2, 4), 16),
                Integer.parseInt(h.substring(4, 6), 16)));
    }

    private static double channel(String s, double scale) {
        if (s.endsWith("%")) return Double.parseDouble(s.substring(0, s.length() - 1)) / 100.0 * scale;
        return Double.parseDouble(s);
    }

    private static int clamp(int v) {
        return Math.max(0, Math.min(255, v));
    }
}
