package com.elementhunter.core.util;

import java.time.Duration;

/** 페이지 사이 대기. 테스트에서는 기록만 하는 구현으로 교체 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    Sleeper NONE = d -> {};

    /** 실제 스레드 대기. 0 이하는 바로 반환 */
    Sleeper THREAD = d -> {
        if (d != null && !d.isNegative() && !d.isZero()) Thread.sleep(d.toMillis());
    };
}
