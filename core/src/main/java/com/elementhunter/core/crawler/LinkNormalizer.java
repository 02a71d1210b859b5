package com.elementhunter.core.crawler;

import com.elementhunter.core.util.UrlUtils;

import java.net.URI;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 원본 href → 같은 호스트의 정규 경로(canonical path).
 * - javascript:/mailto:/tel:, 빈 값, fragment 전용(#...) 은 제외
 * - base origin 기준으로 해석, 호스트가 다르면 버림
 * - query/fragment 제거, 점 세그먼트 정리 후 경로만 유지(허용 안 되는 문자는 인코딩)
 * - 잘못된 URL은 조용히 버림(오류 아님)
 */
public final class LinkNormalizer {
    private LinkNormalizer() {}

    private static final List<String> REJECTED_SCHEMES = List.of("javascript:", "mailto:", "tel:");

    /**
     * 끝 슬래시 제거(결과가 비면 "/"), 앞 슬래시는 정확히 하나. 멱등.
     */
    public static String normalizePath(String path) {
        if (path == null) return "/";
        String p = path.trim();
        int end = p.length();
        while (end > 0 && p.charAt(end - 1) == '/') end--;
        p = p.substring(0, end);
        int start = 0;
        while (start < p.length() && p.charAt(start) == '/') start++;
        p = p.substring(start);
        return "/" + p;
    }

    /** 페이지 단위 집합. 문서 순서(첫 등장) 유지 */
    public static Set<String> normalizeLinks(Collection<String> hrefs, URI base) {
        Set<String> out = new LinkedHashSet<>();
        if (hrefs == null || base == null) return out;
        for (String href : hrefs) {
            normalizeLink(href, base).ifPresent(out::add);
        }
        return out;
    }

    public static Optional<String> normalizeLink(String href, URI base) {
        if (href == null) return Optional.empty();
        String h = href.trim();
        if (h.isEmpty() || h.startsWith("#")) return Optional.empty();
        String lower = h.toLowerCase(Locale.ROOT);
        for (String s : REJECTED_SCHEMES) {
            if (lower.startsWith(s)) return Optional.empty();
        }
        try {
            URI abs = UrlUtils.resolve(base, h);
            if (abs.getHost() == null || !UrlUtils.sameHost(abs, base)) return Optional.empty();
            return Optional.of(normalizePath(abs.getRawPath()));
        } catch (IllegalArgumentException ignore) {
            // 잘못된 URL은 무시
            return Optional.empty();
        }
    }
}
