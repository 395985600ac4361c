package com.jimin.reader.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * FetchWorker 폴링 설정 (reader.worker.*)
 */
@Data
@Validated
@ConfigurationProperties(prefix = "reader.worker")
public class WorkerProperties {

    /** false 면 이 프로세스는 Job 을 처리하지 않음 (API 전용 인스턴스, 테스트) */
    private boolean enabled = true;

    @NotNull
    private Duration pollInterval = Duration.ofSeconds(5);

    /** tick 당 최대 처리 Job 수 */
    @Min(1)
    private int batchSize = 10;
}
