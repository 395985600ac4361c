package com.jimin.reader.service.job;

import com.jimin.reader.entity.JobType;
import com.jimin.reader.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * fetch Job 의 enabled 를 "활성 구독자 존재 여부"와 맞춘다
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class JobLifecycleService {

    private final JobRepository jobRepository;
    private final Clock clock;

    /**
     * enabled = (active 구독이 1개 이상) 을 UPDATE 한 문장으로 반영
     *
     * @return 반영 후 enabled 값. Job 이 없으면 false
     */
    public boolean syncEnabled(Long sourceId) {
        int updated = jobRepository.syncEnabledWithSubscribers(sourceId, clock.instant());
        if (updated == 0) {
            log.debug("sourceId={} 에 fetch Job 없음", sourceId);
            return false;
        }
        boolean enabled = jobRepository.findEnabled(JobType.FETCH_SOURCE, sourceId).orElse(false);
        log.debug("fetch Job enabled 동기화: sourceId={}, enabled={}", sourceId, enabled);
        return enabled;
    }
}
