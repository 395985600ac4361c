package com.jimin.reader.exception;

/**
 * JobPayloadException - payload 가 깨졌거나 필수 값이 없을 때
 *
 * 해당 Job 1회 실행만 실패 처리된다 (워커와 다른 Job 에는 영향 없음)
 */
public class JobPayloadException extends RuntimeException {

    private final Long jobId;

    public JobPayloadException(Long jobId, String message) {
        super("Job payload 오류 (ID: " + jobId + "): " + message);
        this.jobId = jobId;
    }

    public JobPayloadException(Long jobId, String message, Throwable cause) {
        super("Job payload 오류 (ID: " + jobId + "): " + message, cause);
        this.jobId = jobId;
    }

    public Long getJobId() {
        return jobId;
    }
}
