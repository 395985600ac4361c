package com.jimin.reader.config;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Job 큐 설정 (reader.jobs.*)
 */
@Data
@Validated
@ConfigurationProperties(prefix = "reader.jobs")
public class JobProperties {

    /**
     * running_since 가 이보다 오래된 Job 은 버려진 것으로 보고 다시 claim 한다.
     * fetch 최대 소요 시간(timeout x redirect 수)보다 커야 한다.
     */
    @NotNull
    private Duration staleThreshold = Duration.ofMinutes(5);
}
