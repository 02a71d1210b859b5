package com.elementhunter.core.util;

/** 크롤 → 분석 → 저장 단계별 진행 콜백 */
@FunctionalInterface
public interface ProgressListener {

    enum Phase { CRAWL, ANALYZE, EXPORT }

    /**
     * @param progress 0.0~1.0
     * @param done     처리한 페이지 수(저장 단계는 파일 수)
     * @param total    CRAWL 은 maxPages 상한, 나머지는 실제 개수
     */
    void onProgress(Phase phase, double progress, long done, long total);

    ProgressListener NONE = (phase, p, d, t) -> {};
}
