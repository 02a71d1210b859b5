package com.elementhunter.core.api;

import com.elementhunter.core.model.CrawlConfig;
import com.elementhunter.core.model.CrawlOutput;

/** 크롤러 최소 계약: 설정 하나로 사이트 하나를 크롤해 산출물을 돌려준다. */
public interface ICrawler {
    /**
     * @throws IllegalArgumentException 설정 오류(크롤 시작 전)
     */
    CrawlOutput crawl(CrawlConfig config);
}
