package com.jimin.reader.service.source;

import com.jimin.reader.dto.SourceHealthResponse;
import com.jimin.reader.entity.Source;
import com.jimin.reader.exception.SourceNotFoundException;
import com.jimin.reader.repository.SourceRepository;
import com.jimin.reader.service.job.JobQueueService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * 고장난 소스 조회 / 수동 재시도
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class SourceHealthService {

    private final SourceRepository sourceRepository;
    private final JobQueueService jobQueueService;
    private final Clock clock;

    /**
     * 연속 실패가 minFailures 이상인 소스 (최근 fetch 순)
     */
    public List<SourceHealthResponse> findBrokenSources(int minFailures) {
        return sourceRepository
                .findByConsecutiveFailuresGreaterThanEqualOrderByLastFetchedAtDesc(Math.max(1, minFailures))
                .stream()
                .map(SourceHealthResponse::from)
                .toList();
    }

    /**
     * backoff 를 무시하고 다음 폴링에서 바로 fetch
     *
     * @return fetch Job 이 있어서 재예약했으면 true
     */
    @Transactional
    public boolean retryNow(Long sourceId) {
        if (!sourceRepository.existsById(sourceId)) {
            throw new SourceNotFoundException(sourceId);
        }
        boolean rescheduled = jobQueueService.runNow(sourceId);
        if (rescheduled) {
            Source source = sourceRepository.findById(sourceId)
                    .orElseThrow(() -> new SourceNotFoundException(sourceId));
            source.setNextFetchAt(clock.instant());
            sourceRepository.save(source);
            log.info("수동 재시도 예약: sourceId={}", sourceId);
        } else {
            log.warn("수동 재시도 대상 Job 없음: sourceId={}", sourceId);
        }
        return rescheduled;
    }
}
