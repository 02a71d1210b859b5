package com.elementhunter.core.analyzer;

import com.elementhunter.core.model.ElementSample;
import com.elementhunter.core.model.ElementStat;
import com.elementhunter.core.model.PageRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/** 크롤 후 집계(순수 함수) */
public final class PostCrawlAnalyzer {
    private PostCrawlAnalyzer() {}

    public static final int BASE_WIDTH = 800;
    public static final int MIN_WIDTH = 800;
    public static final int MAX_WIDTH = 4000;
    static final int ELEMENT_FACTOR = 5;
    static final double CONTENT_FACTOR = 0.1;

    /**
     * 전체 페이지 중 threshold 이상의 비율로 등장하는 링크(페이지당 1회만 센다).
     * 페이지가 없으면 빈 집합.
     */
    public static Set<String> detectCommonLinks(List<PageRecord> pages, double threshold) {
        Set<String> common = new LinkedHashSet<>();
        if (pages == null || pages.isEmpty()) return common;

        Map<String, Integer> occurrence = new LinkedHashMap<>();
        for (PageRecord p : pages) {
            for (String link : new LinkedHashSet<>(p.getLinks())) {
                occurrence.merge(link, 1, Integer::sum);
            }
        }
        int total = pages.size();
        occurrence.forEach((link, count) -> {
            if (count / (double) total >= threshold) common.add(link);
        });
        return common;
    }

    public static List<String> filterCommonLinks(Collection<String> links, Set<String> commonLinks) {
        List<String> out = new ArrayList<>();
        for (String l : links) {
            if (!commonLinks.contains(l)) out.add(l);
        }
        return out;
    }

    /** 최대 깊이의 페이지 경로들(크롤 순서) */
    public static List<String> findDeepestPages(List<PageRecord> pages) {
        List<String> out = new ArrayList<>();
        if (pages == null || pages.isEmpty()) return out;
        int max = maxDepth(pages);
        for (PageRecord p : pages) {
            if (p.getDepth() == max) out.add(p.getPath());
        }
        return out;
    }

    public static int maxDepth(List<PageRecord> pages) {
        int max = 0;
        for (PageRecord p : pages) max = Math.max(max, p.getDepth());
        return max;
    }

    /** 전체 출현 수가 threshold 이하인 태그, 알파벳순 */
    public static List<String> findRareElements(List<PageRecord> pages, int threshold) {
        Map<String, Integer> totals = new LinkedHashMap<>();
        for (PageRecord p : pages) {
            for (ElementSample e : p.getElements()) {
                totals.merge(e.tag(), e.count(), Integer::sum);
            }
        }
        Set<String> rare = new TreeSet<>();
        totals.forEach((tag, count) -> {
            if (count <= threshold) rare.add(tag);
        });
        return new ArrayList<>(rare);
    }

    /** 태그별 totalCount / pageCount / rarity (처음 등장한 순서) */
    public static Map<String, ElementStat> calculateElementStats(List<PageRecord> pages) {
        Map<String, int[]> acc = new LinkedHashMap<>(); // [totalCount, pageCount]
        for (PageRecord p : pages) {
            Set<String> seenOnPage = new HashSet<>();
            for (ElementSample e : p.getElements()) {
                int[] a = acc.computeIfAbsent(e.tag(), k -> new int[2]);
                a[0] += e.count();
                if (seenOnPage.add(e.tag())) a[1]++;
            }
        }
        int totalPages = pages.size();
        Map<String, ElementStat> out = new LinkedHashMap<>();
        acc.forEach((tag, a) -> out.put(tag,
                new ElementStat(a[0], a[1], RarityTable.effectiveRarity(tag, a[1], totalPages))));
        return out;
    }

    /** round(800 + 요소수×5 + 본문길이×0.1) 을 [800, 4000] 으로 제한 */
    public static int estimatedWidth(long totalElementCount, long contentLength) {
        double width = BASE_WIDTH + totalElementCount * (double) ELEMENT_FACTOR + contentLength * CONTENT_FACTOR;
        long rounded = Math.round(width);
        return (int) Math.min(MAX_WIDTH, Math.max(MIN_WIDTH, rounded));
    }
}
