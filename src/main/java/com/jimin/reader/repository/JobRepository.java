package com.jimin.reader.repository;

import com.jimin.reader.entity.Job;
import com.jimin.reader.entity.JobType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

public interface JobRepository extends JpaRepository<Job, Long> {

    Optional<Job> findByTypeAndSourceId(JobType type, Long sourceId);

    /**
     * 실행 가능한 Job 1개를 골라 row lock
     *
     * FOR UPDATE SKIP LOCKED:
     *   다른 트랜잭션이 잡고 있는 row 는 기다리지 않고 건너뛴다
     *   → 워커 여러 개가 동시에 폴링해도 서로 막히지 않음
     */
    @Query(value = """
            SELECT * FROM jobs
            WHERE enabled = TRUE
              AND type IN (:types)
              AND next_run_at <= :now
              AND (running_since IS NULL OR running_since < :staleBefore)
            ORDER BY next_run_at ASC
            LIMIT 1
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    Optional<Job> lockNextClaimable(@Param("types") Collection<String> types,
                                    @Param("now") Instant now,
                                    @Param("staleBefore") Instant staleBefore);

    /**
     * running_since 조건부 설정 (claim)
     * @return 1 이면 claim 성공, 0 이면 다른 워커가 먼저 가져감
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Job j SET j.runningSince = :now, j.updatedAt = :now
            WHERE j.id = :id AND (j.runningSince IS NULL OR j.runningSince < :staleBefore)
            """)
    int markRunning(@Param("id") Long id, @Param("now") Instant now, @Param("staleBefore") Instant staleBefore);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Job j SET j.runningSince = NULL, j.lastRunAt = :now, j.nextRunAt = :nextRunAt,
                             j.lastError = NULL, j.consecutiveFailures = 0, j.updatedAt = :now
            WHERE j.id = :id
            """)
    int markSucceeded(@Param("id") Long id, @Param("now") Instant now, @Param("nextRunAt") Instant nextRunAt);

    // Why: consecutive_failures + 1 을 DB 에서 계산 (읽고-쓰기 사이 race 방지)
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Job j SET j.runningSince = NULL, j.lastRunAt = :now, j.nextRunAt = :nextRunAt,
                             j.lastError = :error, j.consecutiveFailures = j.consecutiveFailures + 1,
                             j.updatedAt = :now
            WHERE j.id = :id
            """)
    int markFailed(@Param("id") Long id, @Param("now") Instant now,
                   @Param("nextRunAt") Instant nextRunAt, @Param("error") String error);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE Job j SET j.nextRunAt = :nextRunAt, j.updatedAt = :now
            WHERE j.type = :type AND j.sourceId = :sourceId
            """)
    int reschedule(@Param("type") JobType type, @Param("sourceId") Long sourceId,
                   @Param("nextRunAt") Instant nextRunAt, @Param("now") Instant now);

    /**
     * enabled = "활성 구독자가 1명 이상 있는가"
     *
     * 읽고-쓰기 두 단계가 아니라 EXISTS 서브쿼리를 가진 UPDATE 한 문장으로 처리
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
            UPDATE jobs SET enabled = EXISTS (
                    SELECT 1 FROM subscriptions s
                    WHERE s.source_id = :sourceId AND s.active = TRUE),
                updated_at = :now
            WHERE type = 'FETCH_SOURCE' AND source_id = :sourceId
            """, nativeQuery = true)
    int syncEnabledWithSubscribers(@Param("sourceId") Long sourceId, @Param("now") Instant now);

    @Query("SELECT j.enabled FROM Job j WHERE j.type = :type AND j.sourceId = :sourceId")
    Optional<Boolean> findEnabled(@Param("type") JobType type, @Param("sourceId") Long sourceId);
}
