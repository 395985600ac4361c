package com.jimin.reader.exception;

public class SubscriptionNotFoundException extends RuntimeException {

    private final Long userId;
    private final Long sourceId;

    public SubscriptionNotFoundException(Long userId, Long sourceId) {
        super("구독을 찾을 수 없습니다. userId: " + userId + ", sourceId: " + sourceId);
        this.userId = userId;
        this.sourceId = sourceId;
    }

    public Long getUserId() {
        return userId;
    }

    public Long getSourceId() {
        return sourceId;
    }
}
