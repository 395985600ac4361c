package com.jimin.reader.service.fetch;

import java.time.Duration;
import java.time.Instant;

/**
 * 다음 실행 시각 계산 결과
 *
 * @param interval jitter 와 상/하한이 적용된 최종 간격
 */
public record NextRun(
        Instant at,
        Duration interval,
        Reason reason
) {

    public enum Reason {
        CACHE_CONTROL,
        CACHE_CONTROL_CLAMPED_MIN,
        CACHE_CONTROL_CLAMPED_MAX,
        FEED_HINT,
        FEED_HINT_CLAMPED_MIN,
        FEED_HINT_CLAMPED_MAX,
        DEFAULT,
        FAILURE_BACKOFF,
        RETRY_AFTER
    }
}
