package com.jimin.reader.exception;

public class SourceNotFoundException extends RuntimeException {

    private final Long sourceId;

    public SourceNotFoundException(Long sourceId) {
        super("소스를 찾을 수 없습니다. ID: " + sourceId);
        this.sourceId = sourceId;
    }

    public Long getSourceId() {
        return sourceId;
    }
}
