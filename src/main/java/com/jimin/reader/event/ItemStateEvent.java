package com.jimin.reader.event;

import java.time.Instant;

/**
 * item.state_changed payload - 다른 기기에 열려 있는 클라이언트가 읽음/별표를 맞추는 데 쓴다
 */
public record ItemStateEvent(
        Long userId,
        Long itemId,
        boolean read,
        boolean starred,
        Instant readChangedAt,
        Instant starredChangedAt
) {
}
