package com.jimin.reader.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Source Entity - 주기적으로 가져오는 외부 피드
 *
 * DB 테이블: sources
 * 역할: fetch 전용 상태 (캐시 validator, redirect 추적, 실패 카운트)
 *
 * Job의 consecutive_failures 와는 별개다.
 * Job은 "스케줄링 재시도", Source는 "콘텐츠 소스의 건강 상태"를 나타낸다.
 */
@Entity
@Table(name = "sources")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Source {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 1000, unique = true)
    private String url;

    @Column(length = 500)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "site_url", length = 1000)
    private String siteUrl;

    // 조건부 GET (If-None-Match / If-Modified-Since)
    @Column(length = 500)
    private String etag;

    @Column(name = "last_modified_header", length = 100)
    private String lastModifiedHeader;

    // 301 대상 후보. 같은 대상이 연속 3번 관찰돼야 url 로 채택
    @Column(name = "redirect_candidate_url", length = 1000)
    private String redirectCandidateUrl;

    @Column(name = "redirect_confirmations", nullable = false)
    private int redirectConfirmations;

    @Column(name = "consecutive_failures", nullable = false)
    private int consecutiveFailures;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "last_fetched_at")
    private Instant lastFetchedAt;

    // Job.nextRunAt 의 표시용 사본. Job이 disabled 되면 null
    @Column(name = "next_fetch_at")
    private Instant nextFetchAt;

    // 피드 자체 힌트(<ttl>, sy:updatePeriod)에서 얻은 갱신 주기
    @Column(name = "hint_interval_seconds")
    private Long hintIntervalSeconds;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
