package com.jimin.reader.dto;

import com.jimin.reader.entity.Source;
import com.jimin.reader.entity.Subscription;

import java.time.Instant;

/**
 * 구독 / 구독 해지 결과
 *
 * @param jobEnabled  처리 직후 소스 fetch Job 의 활성 여부
 * @param nextFetchAt 다음 fetch 예정 시각 (Job 이 꺼져 있으면 null)
 */
public record SubscriptionResponse(
        Long subscriptionId,
        Long userId,
        Long sourceId,
        String url,
        String title,
        boolean active,
        boolean jobEnabled,
        Instant nextFetchAt
) {
    public static SubscriptionResponse from(Subscription subscription, Source source, boolean jobEnabled) {
        return new SubscriptionResponse(
                subscription.getId(),
                subscription.getUserId(),
                source.getId(),
                source.getUrl(),
                source.getTitle(),
                subscription.isActive(),
                jobEnabled,
                source.getNextFetchAt()
        );
    }
}
