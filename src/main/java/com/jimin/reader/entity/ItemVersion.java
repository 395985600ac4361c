package com.jimin.reader.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * ItemVersion Entity - 내용이 바뀐 Item 의 이전 버전 (append-only)
 *
 * DB 테이블: item_versions
 */
@Entity
@Table(name = "item_versions",
        uniqueConstraints = @UniqueConstraint(name = "uq_item_versions", columnNames = {"item_id", "version"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ItemVersion {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "item_id", nullable = false, updatable = false)
    private Item item;

    // 보관된 시점의 Item.version
    @Column(nullable = false, updatable = false)
    private int version;

    @Column(length = 1000, updatable = false)
    private String title;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String content;

    @Column(name = "content_hash", nullable = false, length = 64, updatable = false)
    private String contentHash;

    @Column(name = "archived_at", nullable = false, updatable = false)
    private Instant archivedAt;
}
