package com.jimin.reader.event;

/**
 * item.created / item.updated payload
 */
public record ItemEvent(
        Long sourceId,
        Long itemId,
        int version
) {
}
