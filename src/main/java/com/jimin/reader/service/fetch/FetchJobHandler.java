package com.jimin.reader.service.fetch;

import com.jimin.reader.entity.Job;
import com.jimin.reader.entity.JobType;
import com.jimin.reader.entity.Source;
import com.jimin.reader.repository.SourceRepository;
import com.jimin.reader.service.job.FetchSourcePayload;
import com.jimin.reader.service.job.JobHandler;
import com.jimin.reader.service.job.JobOutcome;
import com.jimin.reader.service.job.JobPayloads;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * FETCH_SOURCE Job 처리
 *
 * 1. payload 에서 sourceId 읽기
 * 2. Source 의 url / validator 로 조건부 GET (트랜잭션 없음)
 * 3. FetchResultApplier 가 별도 트랜잭션에서 결과 반영
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FetchJobHandler implements JobHandler {

    private final JobPayloads jobPayloads;
    private final SourceRepository sourceRepository;
    private final SourceFetcher sourceFetcher;
    private final FetchResultApplier resultApplier;
    private final FetchScheduleCalculator scheduleCalculator;
    private final Clock clock;

    @Override
    public JobType type() {
        return JobType.FETCH_SOURCE;
    }

    @Override
    public JobOutcome handle(Job job) {
        FetchSourcePayload payload = jobPayloads.readFetchSource(job);

        Optional<Source> found = sourceRepository.findById(payload.sourceId());
        if (found.isEmpty()) {
            // Job 은 남아 있는데 Source 가 없음 → 지우지 않고 backoff
            log.error("Job 의 소스가 없음: jobId={}, sourceId={}", job.getId(), payload.sourceId());
            NextRun next = scheduleCalculator.afterFailure(job.getConsecutiveFailures() + 1, clock.instant());
            return JobOutcome.failed(next.at(), "Source not found: " + payload.sourceId());
        }

        Source source = found.get();
        FetchRequest request = new FetchRequest(
                source.getId(), source.getUrl(), source.getEtag(), source.getLastModifiedHeader());

        log.debug("fetch 시작: sourceId={}, url={}", source.getId(), source.getUrl());
        FetchResult result = sourceFetcher.fetch(request);
        return resultApplier.apply(source.getId(), result);
    }
}
