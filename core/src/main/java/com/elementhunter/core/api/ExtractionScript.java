package com.elementhunter.core.api;

import org.jsoup.nodes.Document;

/**
 * 페이지 드라이버가 현재 문서에 대해 실행하는 추출 절차.
 * 코어는 이름/버전과 결과 타입에만 의존하고, 실행 환경은 드라이버가 정한다.
 *
 * @param <T> 결과 타입
 */
public interface ExtractionScript<T> {

    /** 로그/진단용 이름 */
    String name();

    /** 결과 형태가 바뀌면 올린다 */
    int version();

    /**
     * 로드된 문서에 대해 실행. 문서를 변경하면 안 된다(분리된 사본에서 작업할 것).
     */
    T evaluate(Document document);
}
