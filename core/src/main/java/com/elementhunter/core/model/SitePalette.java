package com.elementhunter.core.model;

/**
 * 사이트 대표 색상(#rrggbb). 루트 페이지에서 한 번만 계산한다.
 *
 * @param themeColor {@code <meta name="theme-color">} 값(없으면 null)
 */
public record SitePalette(
        String backgroundColor,
        String primaryColor,
        String accentColor,
        String textColor,
        String themeColor) {

    /** 추출 실패 시 대체값 */
    public static final SitePalette DEFAULT =
            new SitePalette("#ffffff", "#0088ff", "#0088ff", "#333333", null);
}
