package com.jimin.reader.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Subscription Entity - 사용자 ↔ 소스 구독 관계
 *
 * DB 테이블: subscriptions
 * 구독 해지는 row 삭제 대신 active=false (재구독 시 같은 row 재사용)
 */
@Entity
@Table(name = "subscriptions",
        uniqueConstraints = @UniqueConstraint(name = "uq_subscriptions_user_source", columnNames = {"user_id", "source_id"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Subscription {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "source_id", nullable = false)
    private Long sourceId;

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "subscribed_at", nullable = false)
    private Instant subscribedAt;

    @Column(name = "unsubscribed_at")
    private Instant unsubscribedAt;
}
