package com.jimin.reader.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * UserItemState Entity - 사용자별 Item 읽음/별표 상태
 *
 * DB 테이블: user_item_states
 * PK: (user_id, item_id)
 *
 * 필드마다 "마지막 변경 시각"을 따로 가진다.
 * 변경 요청의 changedAt 이 저장된 *_changed_at 보다 클 때만 값을 덮어쓴다 (같거나 오래되면 no-op).
 */
@Entity
@Table(name = "user_item_states")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserItemState {

    @EmbeddedId
    private UserItemStateId id;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @Column(name = "read_changed_at", nullable = false)
    private Instant readChangedAt;

    @Column(name = "is_starred", nullable = false)
    private boolean starred;

    @Column(name = "starred_changed_at", nullable = false)
    private Instant starredChangedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static UserItemState unread(Long userId, Long itemId, Instant observedAt) {
        return new UserItemState(new UserItemStateId(userId, itemId),
                false, observedAt, false, observedAt, observedAt);
    }
}
