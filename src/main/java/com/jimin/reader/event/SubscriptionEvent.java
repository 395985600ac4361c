package com.jimin.reader.event;

/**
 * subscription.created / subscription.removed payload
 *
 * @param jobEnabled 이벤트 직후 소스의 fetch Job 활성 여부
 */
public record SubscriptionEvent(
        Long userId,
        Long sourceId,
        boolean jobEnabled
) {
}
