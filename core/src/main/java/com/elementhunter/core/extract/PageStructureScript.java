package com.elementhunter.core.extract;

import com.elementhunter.core.api.ExtractionScript;
import com.elementhunter.core.model.ExtractedPage;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 페이지 구조 추출: 태그 집계/샘플, 원본 href, 본문 발췌, 대표 이미지, og:image.
 * 이미지 URL 은 원본 그대로 돌려준다(절대 URL 변환은 {@link PageExtractor}).
 */
public final class PageStructureScript implements ExtractionScript<ExtractedPage> {

    @Override public String name() { return "page-structure"; }
    @Override public int version() { return 1; }

    @Override
    public ExtractedPage evaluate(Document doc) {
        TagCensus census = TagCensus.of(doc);

        List<String> rawLinks = new ArrayList<>();
        for (Element a : doc.select("a[href]")) {
            rawLinks.add(a.attr("href"));
        }

        Element body = doc.body();
        int contentLength = body == null ? 0 : body.wholeText().length();

        return new ExtractedPage(
                doc.title(),
                census.samples(),
                census.totalCount(),
                rawLinks,
                contentLength,
                ReadableContent.extract(doc),
                shortlist(doc),
                ogImage(doc));
    }

    static List<String> shortlist(Document doc) {
        Set<String> out = new LinkedHashSet<>();
        for (Element img : doc.select("img[src]")) {
            if (out.size() >= ImageFilters.SHORTLIST_MAX) break;
            if (ImageFilters.acceptShortlist(img)) out.add(img.attr("src").trim());
        }
        return new ArrayList<>(out);
    }

    static String ogImage(Document doc) {
        Element meta = doc.selectFirst("meta[property=og:image]");
        if (meta == null) return null;
        String content = meta.attr("content").trim();
        return content.isEmpty() ? null : content;
    }
}
