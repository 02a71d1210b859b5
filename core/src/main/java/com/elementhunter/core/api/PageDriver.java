package com.elementhunter.core.api;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * 페이지 드라이버 계약: 탐색 → (로드 완료 대기) → 추출 스크립트 실행.
 * 크롤 하나 동안 한 인스턴스를 직렬로 재사용한다(동시 사용 없음).
 */
public interface PageDriver extends AutoCloseable {

    /**
     * URL로 이동하고 로드가 끝날 때까지 기다린다.
     * 실패하면 현재 페이지는 비워진다.
     *
     * @throws IOException 네트워크 오류, 타임아웃, HTTP 오류 상태, HTML 이 아닌 응답
     */
    void navigate(URI url) throws IOException;

    /**
     * 현재 페이지에 대해 스크립트 실행.
     *
     * @throws IllegalStateException 로드된 페이지가 없을 때
     */
    <T> T evaluate(ExtractionScript<T> script);

    /** 이후 navigate 에 적용할 타임아웃 */
    void setTimeout(Duration timeout);

    @Override default void close() {}
}
