package com.jimin.reader.service.job;

import com.jimin.reader.config.WorkerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Job 폴링 워커
 *
 * 프로세스를 여러 개 띄워도 된다. 조율은 전부 DB row lock 으로 한다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "reader.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class FetchWorker {

    private final JobRunner jobRunner;
    private final WorkerProperties properties;

    @Scheduled(fixedDelayString = "${reader.worker.poll-interval:5s}")
    public void poll() {
        int processed = 0;
        while (processed < properties.getBatchSize() && jobRunner.runOnce()) {
            processed++;
        }
        if (processed > 0) {
            log.info("Job {} 건 처리", processed);
        }
    }
}
