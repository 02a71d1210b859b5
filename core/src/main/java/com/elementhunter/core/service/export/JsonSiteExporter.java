package com.elementhunter.core.service.export;

import com.elementhunter.core.model.CrawlOutput;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {siteId}.json Exporter (pretty print, UTF-8).
 */
public class JsonSiteExporter implements SiteExporter {

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Override
    public Path export(Path baseDir, CrawlOutput output) throws IOException {
        Objects.requireNonNull(output, "output");
        Path outFile = SiteNaming.jsonPath(baseDir, output.siteId());
        if (outFile.getParent() != null) {
            Files.createDirectories(outFile.getParent());
        }
        // Jackson 기본 인코딩은 UTF-8
        om.writerWithDefaultPrettyPrinter().writeValue(outFile.toFile(), output);
        return outFile;
    }

    /** 테스트/도구용: 같은 매퍼 설정으로 다시 읽기 */
    public CrawlOutput read(Path file) throws IOException {
        return om.readValue(file.toFile(), CrawlOutput.class);
    }
}
