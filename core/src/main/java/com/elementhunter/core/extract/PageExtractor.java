package com.elementhunter.core.extract;

import com.elementhunter.core.api.PageDriver;
import com.elementhunter.core.model.ElementSample;
import com.elementhunter.core.model.ExtractedPage;
import com.elementhunter.core.model.SitePalette;
import com.elementhunter.core.util.UrlUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 드라이버의 현재 페이지에서 추출 스크립트를 실행하고 후처리(이미지 URL 절대화)한다.
 */
public class PageExtractor {

    private final PageStructureScript structureScript;
    private final PaletteScript paletteScript;

    public PageExtractor() {
        this(new PageStructureScript(), new PaletteScript());
    }

    public PageExtractor(PageStructureScript structureScript, PaletteScript paletteScript) {
        this.structureScript = Objects.requireNonNull(structureScript, "structureScript");
        this.paletteScript = Objects.requireNonNull(paletteScript, "paletteScript");
    }

    /**
     * @param baseUrl 이미지 URL 해석 기준(크롤 origin)
     */
    public ExtractedPage extract(PageDriver driver, URI baseUrl) {
        ExtractedPage raw = driver.evaluate(structureScript);
        return absolutize(raw, baseUrl);
    }

    /** 후보가 없으면 empty. 스크립트 예외는 그대로 던진다(호출자가 기본 팔레트로 대체) */
    public Optional<SitePalette> extractPalette(PageDriver driver) {
        return driver.evaluate(paletteScript);
    }

    static ExtractedPage absolutize(ExtractedPage raw, URI base) {
        List<ElementSample> elements = new ArrayList<>(raw.elements().size());
        for (ElementSample s : raw.elements()) {
            if (s.sampleImageUrls() == null) {
                elements.add(s);
            } else {
                elements.add(ElementSample.ofImages(s.count(), absolutizeAll(s.sampleImageUrls(), base)));
            }
        }
        String og = raw.ogImage() == null ? null : UrlUtils.toAbsolute(base, raw.ogImage());
        return new ExtractedPage(raw.title(), elements, raw.totalElementCount(), raw.rawLinks(),
                raw.contentLength(), raw.textContent(), absolutizeAll(raw.imageUrls(), base), og);
    }

    private static List<String> absolutizeAll(List<String> urls, URI base) {
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String u : urls) out.add(UrlUtils.toAbsolute(base, u));
        return new ArrayList<>(out);
    }
}
