package com.elementhunter.core.extract;

import com.elementhunter.core.model.ElementSample;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 태그 집계 + 태그별 샘플 수집.
 * 결과는 출현 수 내림차순(동률이면 처음 등장한 순서).
 */
final class TagCensus {

    static final Set<String> SKIPPED_TAGS = Set.of("script", "style", "meta", "link", "noscript");
    static final int MIN_TEXT_LENGTH = 3;
    static final int MAX_TEXT_LENGTH = 50;
    static final String ELLIPSIS = "…";

    private static final class Bucket {
        int count;
        final Set<String> samples = new LinkedHashSet<>();
    }

    private final Map<String, Bucket> buckets = new LinkedHashMap<>();

    static TagCensus of(Document doc) {
        TagCensus census = new TagCensus();
        for (Element el : doc.getAllElements()) {
            if (el instanceof Document) continue;
            census.add(el);
        }
        return census;
    }

    private void add(Element el) {
        String tag = el.normalName().toLowerCase(Locale.ROOT);
        if (SKIPPED_TAGS.contains(tag)) return;
        Bucket b = buckets.computeIfAbsent(tag, k -> new Bucket());
        b.count++;
        if (b.samples.size() >= ElementSample.MAX_SAMPLES) return;

        if (ElementSample.IMG.equals(tag)) {
            if (ImageFilters.acceptSample(el)) b.samples.add(el.attr("src").trim());
        } else {
            String text = sampleText(el.ownText());
            if (text != null) b.samples.add(text);
        }
    }

    List<ElementSample> samples() {
        List<ElementSample> out = new ArrayList<>(buckets.size());
        buckets.forEach((tag, b) -> out.add(ElementSample.IMG.equals(tag)
                ? ElementSample.ofImages(b.count, new ArrayList<>(b.samples))
                : ElementSample.ofTexts(tag, b.count, new ArrayList<>(b.samples))));
        out.sort(Comparator.comparingInt(ElementSample::count).reversed());
        return out;
    }

    int totalCount() {
        int sum = 0;
        for (Bucket b : buckets.values()) sum += b.count;
        return sum;
    }

    /** 공백 정리 후 3자 미만이면 null, 50자 초과면 49자 + … */
    static String sampleText(String raw) {
        if (raw == null) return null;
        String t = raw.replaceAll("\\s+", " ").trim();
        if (t.length() < MIN_TEXT_LENGTH) return null;
        if (t.length() > MAX_TEXT_LENGTH) {
            t = t.substring(0, MAX_TEXT_LENGTH - ELLIPSIS.length()) + ELLIPSIS;
        }
        return t;
    }
}
