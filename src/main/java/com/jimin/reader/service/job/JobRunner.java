package com.jimin.reader.service.job;

import com.jimin.reader.entity.Job;
import com.jimin.reader.entity.JobType;
import com.jimin.reader.service.fetch.FetchScheduleCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * claim → 실행 → finish 한 사이클
 *
 * 세 단계는 각각 별도 트랜잭션이다. 실행(네트워크 I/O) 중에는 트랜잭션을 열어두지 않는다.
 * 한 Job 의 실패가 다른 Job 처리를 막지 않도록 handler 예외는 여기서 모두 실패 결과로 바꾼다.
 */
@Service
@Slf4j
public class JobRunner {

    private final JobQueueService jobQueueService;
    private final FetchScheduleCalculator scheduleCalculator;
    private final Clock clock;
    private final Map<JobType, JobHandler> handlers = new EnumMap<>(JobType.class);

    public JobRunner(JobQueueService jobQueueService,
                     FetchScheduleCalculator scheduleCalculator,
                     Clock clock,
                     List<JobHandler> jobHandlers) {
        this.jobQueueService = jobQueueService;
        this.scheduleCalculator = scheduleCalculator;
        this.clock = clock;
        for (JobHandler handler : jobHandlers) {
            handlers.put(handler.type(), handler);
        }
    }

    /**
     * @return Job 을 하나 처리했으면 true, 실행할 Job 이 없으면 false
     */
    public boolean runOnce() {
        Optional<Job> claimed = jobQueueService.claimNext(handlers.keySet());
        if (claimed.isEmpty()) {
            return false;
        }

        Job job = claimed.get();
        JobOutcome outcome = execute(job);
        try {
            jobQueueService.finish(job.getId(), outcome);
        } catch (RuntimeException e) {
            // running_since 가 남아 있으므로 stale threshold 이후 다시 claim 된다
            log.error("Job 결과 저장 실패: id={}, type={}", job.getId(), job.getType(), e);
        }
        return true;
    }

    private JobOutcome execute(Job job) {
        JobHandler handler = handlers.get(job.getType());
        try {
            return handler.handle(job);
        } catch (RuntimeException e) {
            log.error("Job 실행 중 예외: id={}, type={}, payload={}, failures={}",
                    job.getId(), job.getType(), job.getPayload(), job.getConsecutiveFailures(), e);
            Instant nextRunAt = scheduleCalculator
                    .afterFailure(job.getConsecutiveFailures() + 1, clock.instant())
                    .at();
            return JobOutcome.failed(nextRunAt, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
