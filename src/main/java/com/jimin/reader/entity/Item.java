package com.jimin.reader.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Item Entity - 소스에서 관찰한 개별 콘텐츠 (피드 entry)
 *
 * DB 테이블: items
 * 관계: Item N:1 Source
 *
 * ItemReconciler 만 생성/수정한다. 삭제는 하지 않는다.
 * content_hash 가 바뀌면 이전 내용은 ItemVersion 으로 보관되고 version 이 1 증가한다.
 */
@Entity
@Table(name = "items",
        uniqueConstraints = @UniqueConstraint(name = "uq_items_source_key", columnNames = {"source_id", "dedupe_key"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Item {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "source_id", nullable = false)
    private Source source;

    // 피드가 준 guid/id (없을 수 있음)
    @Column(name = "external_id", length = 1000)
    private String externalId;

    // Why: externalId → link → title 순서의 fallback 키. 조회는 항상 이 컬럼으로
    @Column(name = "dedupe_key", nullable = false, length = 1000)
    private String dedupeKey;

    @Column(length = 1000)
    private String url;

    @Column(length = 1000)
    private String title;

    @Column(length = 300)
    private String author;

    @Column(columnDefinition = "TEXT")
    private String content;

    @Column(columnDefinition = "TEXT")
    private String summary;

    @Column(name = "published_at")
    private Instant publishedAt;

    // SHA-256(title + "\n" + content)
    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @Column(nullable = false)
    private int version;

    @Column(name = "first_seen_at", nullable = false, updatable = false)
    private Instant firstSeenAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
