package com.elementhunter.core.service.export;

import com.elementhunter.core.model.CrawlMetadata;
import com.elementhunter.core.model.CrawlOutput;
import com.elementhunter.core.model.ElementSample;
import com.elementhunter.core.model.ElementStat;
import com.elementhunter.core.model.PageOutput;
import com.elementhunter.core.model.SitePalette;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JsonSiteExporter — {siteId}.json")
class JsonSiteExporterTest {

    @TempDir
    Path dir;

    private static CrawlOutput sample() {
        return sample("example");
    }

    private static CrawlOutput sample(String siteId) {
        PageOutput root = new PageOutput("/", 0, "홈", List.of(
                ElementSample.ofTexts("p", 2, List.of("안녕하세요")),
                ElementSample.ofImages(1, List.of("https://example.com/photo.jpg"))),
                3, List.of("/about"), null, 120, 815, "<p>안녕하세요</p>",
                List.of("https://example.com/photo.jpg"), null);
        Map<String, ElementStat> stats = new LinkedHashMap<>();
        stats.put("p", new ElementStat(2, 1, 1));
        stats.put("img", new ElementStat(1, 1, 1));
        return new CrawlOutput(siteId, "Example", "https://example.com",
                new CrawlMetadata("2024-05-01T00:00:00Z", "0.1.0", 1, 3, 0, 1234L),
                SitePalette.DEFAULT, List.of(root), List.of("/"), List.of("img", "p"), List.of(), stats);
    }

    @Test
    @DisplayName("디렉터리를 만들고 호환 키 이름으로 UTF-8 pretty JSON 을 쓴다")
    void writesJson() throws Exception {
        Path out = dir.resolve("nested/sites");
        Path file = new JsonSiteExporter().export(out, sample());

        assertThat(file).isEqualTo(out.resolve("example.json")).exists();
        String json = Files.readString(file, StandardCharsets.UTF_8);
        assertThat(json).contains("\n").contains("안녕하세요");

        JsonNode root = new ObjectMapper().readTree(json);
        assertThat(root.fieldNames()).toIterable().containsExactly(
                "siteId", "siteName", "baseUrl", "metadata", "siteStyle", "pages",
                "deepestPages", "rareElements", "commonLinks", "elementStats");
        assertThat(root.at("/metadata/crawlDuration").asLong()).isEqualTo(1234L);
        assertThat(root.at("/siteStyle/themeColor").isNull()).isTrue();

        JsonNode page = root.at("/pages/0");
        assertThat(page.has("parentLink")).isTrue();
        assertThat(page.get("parentLink").isNull()).isTrue();
        assertThat(page.get("estimatedWidth").asInt()).isEqualTo(815);

        JsonNode p = page.at("/elements/0");
        assertThat(p.get("tag").asText()).isEqualTo("p");
        assertThat(p.has("sampleImageUrls")).isFalse();
        JsonNode img = page.at("/elements/1");
        assertThat(img.get("sampleImageUrls").get(0).asText()).isEqualTo("https://example.com/photo.jpg");
        assertThat(img.get("sampleTexts").size()).isZero();
        assertThat(root.at("/elementStats/p/rarity").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("다시 읽으면 같은 값")
    void readsBack() throws Exception {
        JsonSiteExporter exporter = new JsonSiteExporter();
        CrawlOutput original = sample();
        CrawlOutput back = exporter.read(exporter.export(dir, original));
        assertThat(back).isEqualTo(original);
    }

    @Test
    @DisplayName("명시한 siteId 의 대소문자가 파일명에 그대로 남는다")
    void keepsSiteIdCase() throws Exception {
        Path file = new JsonSiteExporter().export(dir, sample("MySite"));

        assertThat(file.getFileName().toString()).isEqualTo("MySite.json");
        assertThat(new ObjectMapper().readTree(file.toFile()).get("siteId").asText()).isEqualTo("MySite");
    }

    @Test
    @DisplayName("파일명으로 쓸 수 없는 siteId 는 정리")
    void naming() {
        assertThat(SiteNaming.fileStem("My Site/../x")).isEqualTo("My Site-..-x");
        assertThat(SiteNaming.fileStem("a:b*c?d\"e<f>g|h\\i")).isEqualTo("a-b-c-d-e-f-g-h-i");
        assertThat(SiteNaming.fileStem("../up")).isEqualTo("-up");
        assertThat(SiteNaming.fileStem(" .hidden. ")).isEqualTo("hidden");
        assertThat(SiteNaming.fileStem("")).isEqualTo("site");
        assertThat(SiteNaming.fileStem("..")).isEqualTo("site");
        assertThat(SiteNaming.fileStem(null)).isEqualTo("site");
        assertThat(SiteNaming.fileStem("example-co")).isEqualTo("example-co");
        assertThat(SiteNaming.jsonPath(null, "ex")).isEqualTo(SiteNaming.DEFAULT_DIR.resolve("ex.json"));
    }
}
