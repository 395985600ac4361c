package com.jimin.reader.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Job Entity - 주기적으로 실행되는 작업 단위
 *
 * DB 테이블: jobs
 * 역할: 스케줄링 상태를 전부 DB row로 보관 → 워커 프로세스는 상태 없이 폴링만 한다
 * 규칙: (type, source_id) 당 Job은 정확히 1개 (UNIQUE)
 *
 * running_since != null 이면 "누군가 처리 중". 단, stale threshold(기본 5분)보다 오래됐으면
 * 워커가 죽은 것으로 보고 다시 claim 할 수 있다.
 */
@Entity
@Table(name = "jobs",
        uniqueConstraints = @UniqueConstraint(name = "uq_jobs_type_source", columnNames = {"type", "source_id"}),
        indexes = @Index(name = "idx_jobs_polling", columnList = "enabled, next_run_at"))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private JobType type;

    // JSON (예: {"sourceId":42})
    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    // Why: payload 안의 sourceId를 컬럼으로 빼서 UNIQUE 제약과 lifecycle 조회에 사용
    @Column(name = "source_id")
    private Long sourceId;

    @Column(nullable = false)
    private boolean enabled = true;

    @Column(name = "next_run_at")
    private Instant nextRunAt;

    @Column(name = "running_since")
    private Instant runningSince;

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "consecutive_failures", nullable = false)
    private int consecutiveFailures;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }

    public boolean isRunning() {
        return runningSince != null;
    }
}
