package com.jimin.reader.service.job;

import java.time.Instant;

/**
 * Job 1회 실행 결과 → JobQueueService.finish() 로 기록
 *
 * @param nextRunAt 다음 실행 시각 (실패 시 backoff 가 이미 반영된 값)
 * @param error     실패 사유 (성공이면 null)
 */
public record JobOutcome(
        boolean success,
        Instant nextRunAt,
        String error
) {
    public static JobOutcome succeeded(Instant nextRunAt) {
        return new JobOutcome(true, nextRunAt, null);
    }

    public static JobOutcome failed(Instant nextRunAt, String error) {
        return new JobOutcome(false, nextRunAt, error != null ? error : "Unknown error");
    }
}
