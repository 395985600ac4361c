package com.jimin.reader.event;

import java.time.Instant;

/**
 * EventBus 로 발행되는 메시지 (Spring ApplicationEvent 로 전달)
 */
public record BusEvent(
        String topic,
        Object payload,
        Instant publishedAt
) {
}
