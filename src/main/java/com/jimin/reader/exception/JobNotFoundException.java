package com.jimin.reader.exception;

/**
 * 존재하지 않는 Job 을 finish 하려 할 때
 */
public class JobNotFoundException extends RuntimeException {

    private final Long jobId;

    public JobNotFoundException(Long jobId) {
        super("Job 을 찾을 수 없습니다. ID: " + jobId);
        this.jobId = jobId;
    }

    public Long getJobId() {
        return jobId;
    }
}
