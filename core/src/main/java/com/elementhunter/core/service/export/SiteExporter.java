package com.elementhunter.core.service.export;

import com.elementhunter.core.model.CrawlOutput;

import java.io.IOException;
import java.nio.file.Path;

/** 크롤 산출물을 파일로 내보내는 책임 */
public interface SiteExporter {
    /**
     * @param baseDir 출력 디렉터리(없으면 만든다)
     * @param output  크롤 산출물
     * @return 생성된 파일 경로
     */
    Path export(Path baseDir, CrawlOutput output) throws IOException;
}
