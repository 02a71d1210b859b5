package com.elementhunter.core.extract;

import com.elementhunter.core.api.ExtractionScript;
import com.elementhunter.core.model.SitePalette;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 사이트 팔레트 추출(루트 페이지 전용).
 * 후보 색 = 무채색이 아니고 채도 0.3 초과. 점수 = 출처 가중치 + 채도×5.
 * primary = 최고점, accent = 다음 고유 색. theme-color(hex) 가 있으면 primary 를 덮어쓴다.
 * 후보가 없으면 empty → 호출자가 기본 팔레트로 대체.
 */
public final class PaletteScript implements ExtractionScript<Optional<SitePalette>> {

    static final CssColor DEFAULT_BACKGROUND = new CssColor(255, 255, 255);

    /** 후보 출처(셀렉터는 속성/클래스 부분 문자열 휴리스틱) */
    enum Source {
        CTA(10, "button, [role=button], input[type=submit], input[type=button], "
                + "[class*=btn], [class*=button], [class*=cta], [id*=cta]"),
        HEADER(5, "header, nav, [class*=header], [class*=nav], [id*=header], [id*=nav]"),
        HEADING(2, "h1, h2, h3, strong, b, em, mark"),
        LINK(1, "a");

        final int weight;
        final String selector;

        Source(int weight, String selector) {
            this.weight = weight;
            this.selector = selector;
        }
    }

    /** 출처별로 보는 요소 수 상한 */
    static final int MAX_ELEMENTS_PER_SOURCE = 50;
    static final double MIN_SATURATION = 0.3;

    @Override public String name() { return "site-palette"; }
    @Override public int version() { return 1; }

    @Override
    public Optional<SitePalette> evaluate(Document document) {
        StyleResolver styles = StyleResolver.of(document);

        Element body = document.body();
        Element html = document.selectFirst("html");

        CssColor background = backgroundOf(styles, body)
                .or(() -> backgroundOf(styles, html))
                .orElse(DEFAULT_BACKGROUND);
        CssColor text = styles.color(body != null ? body : (html != null ? html : document));

        List<Candidate> ranked = rankCandidates(document, styles);
        if (ranked.isEmpty()) return Optional.empty();

        String primary = ranked.get(0).hex();
        String accent = ranked.size() > 1 ? ranked.get(1).hex() : primary;

        Optional<String> themeColor = themeColor(document);
        if (themeColor.isPresent()) primary = themeColor.get();

        return Optional.of(new SitePalette(
                background.toHex(), primary, accent, text.toHex(), themeColor.orElse(null)));
    }

    record Candidate(String hex, double score) {}

    /** 색상별 최고 점수, 점수 내림차순 */
    static List<Candidate> rankCandidates(Document document, StyleResolver styles) {
        Map<String, Double> best = new LinkedHashMap<>();
        for (Source src : Source.values()) {
            int seen = 0;
            for (Element el : document.select(src.selector)) {
                if (seen++ >= MAX_ELEMENTS_PER_SOURCE) break;
                styles.backgroundColor(el).ifPresent(c -> offer(best, c, src.weight));
                offer(best, styles.color(el), src.weight);
            }
        }
        List<Candidate> out = new ArrayList<>();
        best.forEach((hex, score) -> out.add(new Candidate(hex, score)));
        out.sort(Comparator.comparingDouble(Candidate::score).reversed());
        return out;
    }

    private static void offer(Map<String, Double> best, CssColor c, int weight) {
        if (c.isNeutral()) return;
        double sat = c.saturation();
        if (sat <= MIN_SATURATION) return;
        double score = weight + sat * 5.0;
        best.merge(c.toHex(), score, Math::max);
    }

    private static Optional<CssColor> backgroundOf(StyleResolver styles, Element el) {
        return el == null ? Optional.empty() : styles.backgroundColor(el);
    }

    static Optional<String> themeColor(Document document) {
        Element meta = document.selectFirst("meta[name=theme-color]");
        return meta == null ? Optional.empty() : CssColor.normalizeHex(meta.attr("content"));
    }
}
