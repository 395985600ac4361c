package com.jimin.reader.service.job;

import com.jimin.reader.config.JobProperties;
import com.jimin.reader.entity.Job;
import com.jimin.reader.entity.JobType;
import com.jimin.reader.exception.JobNotFoundException;
import com.jimin.reader.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * DB 기반 Job 큐
 *
 * "작업 1개 = row 1개" 모델: 소스마다 FETCH_SOURCE Job 이 딱 하나 있고, 실행할 때마다 그 row 를 갱신한다.
 * 워커는 메모리에 상태를 들고 있지 않는다. claim 은 트랜잭션 하나 안에서 끝나고,
 * 네트워크 fetch 는 claim 트랜잭션이 커밋된 뒤에 한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class JobQueueService {

    private final JobRepository jobRepository;
    private final JobPayloads jobPayloads;
    private final JobProperties properties;
    private final Clock clock;

    public Optional<Job> claimNext() {
        return claimNext(EnumSet.allOf(JobType.class));
    }

    /**
     * 실행할 Job 하나를 claim
     *
     * 조건: enabled, next_run_at <= now, (running_since 없음 OR stale)
     * 순서: next_run_at 오름차순 (엄격한 FIFO 보장은 아님)
     *
     * @return claim 한 Job (running_since = now). 실행할 Job 이 없으면 empty (오류 아님)
     */
    public Optional<Job> claimNext(Collection<JobType> types) {
        if (types.isEmpty()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        Instant staleBefore = now.minus(properties.getStaleThreshold());
        List<String> typeNames = types.stream().map(Enum::name).toList();

        Optional<Job> candidate = jobRepository.lockNextClaimable(typeNames, now, staleBefore);
        if (candidate.isEmpty()) {
            return Optional.empty();
        }

        Job job = candidate.get();
        Instant previousRunningSince = job.getRunningSince();
        // Why: SKIP LOCKED 를 지원하지 않는 경로로 들어와도 조건부 UPDATE 가 한 명만 통과시킨다
        if (jobRepository.markRunning(job.getId(), now, staleBefore) == 0) {
            log.debug("Job {} 은 다른 워커가 먼저 claim", job.getId());
            return Optional.empty();
        }
        if (previousRunningSince != null) {
            log.warn("stale Job 재claim: id={}, type={}, running_since={}",
                    job.getId(), job.getType(), previousRunningSince);
        }
        return jobRepository.findById(job.getId());
    }

    /**
     * 실행 결과 기록
     *
     * 성공: running_since 해제, last_run_at = now, next_run_at 설정, last_error 삭제, 실패 카운트 0
     * 실패: running_since 해제, last_run_at = now, backoff 된 next_run_at, last_error 기록, 실패 카운트 +1
     *
     * 실행 도중 disabled 된 Job 도 결과는 기록된다 (다음 폴링에서 claim 되지 않을 뿐)
     */
    public Job finish(Long jobId, JobOutcome outcome) {
        Instant now = clock.instant();
        int updated = outcome.success()
                ? jobRepository.markSucceeded(jobId, now, outcome.nextRunAt())
                : jobRepository.markFailed(jobId, now, outcome.nextRunAt(), outcome.error());
        if (updated == 0) {
            throw new JobNotFoundException(jobId);
        }
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * 소스의 fetch Job 을 찾거나 만들고 enabled 로 둔다 (멱등)
     *
     * "생성"과 "활성화"를 따로 두지 않는다 → 재구독 시 Job 이 안 생기는 문제 방지.
     * 기존 Job 의 next_run_at 은 유지하고, 비어 있을 때만 now 로 채운다.
     * 같은 소스에 대한 동시 호출은 호출자(SubscriptionService)가 source row lock 으로 직렬화한다.
     */
    public Job ensureFetchJob(Long sourceId) {
        Instant now = clock.instant();
        Optional<Job> existing = jobRepository.findByTypeAndSourceId(JobType.FETCH_SOURCE, sourceId);
        if (existing.isPresent()) {
            Job job = existing.get();
            job.setEnabled(true);
            if (job.getNextRunAt() == null) {
                job.setNextRunAt(now);
            }
            job.setUpdatedAt(now);
            return jobRepository.saveAndFlush(job);
        }

        Job job = new Job();
        job.setType(JobType.FETCH_SOURCE);
        job.setSourceId(sourceId);
        job.setPayload(jobPayloads.write(new FetchSourcePayload(sourceId)));
        job.setEnabled(true);
        job.setNextRunAt(now);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        Job saved = jobRepository.saveAndFlush(job);
        log.info("fetch Job 생성: jobId={}, sourceId={}", saved.getId(), sourceId);
        return saved;
    }

    /**
     * 수동 재시도: 다음 폴링에서 바로 실행되도록 next_run_at = now
     * @return 대상 Job 이 있었는지
     */
    public boolean runNow(Long sourceId) {
        Instant now = clock.instant();
        return jobRepository.reschedule(JobType.FETCH_SOURCE, sourceId, now, now) > 0;
    }

    @Transactional(readOnly = true)
    public Optional<Job> findFetchJob(Long sourceId) {
        return jobRepository.findByTypeAndSourceId(JobType.FETCH_SOURCE, sourceId);
    }
}
