package com.jimin.reader.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 피드 fetch / 다음 실행 시각 계산 설정 (reader.fetch.*)
 *
 * 모든 간격은 FLOOR(1분) ~ CEILING(7일) 범위로 다시 한번 잘린다.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "reader.fetch")
public class FetchProperties {

    /** 어떤 설정이든 이보다 자주 폴링하지 않는다 */
    public static final Duration FLOOR = Duration.ofMinutes(1);

    /** 고장난 소스라도 최소 이 간격으로는 다시 시도한다 */
    public static final Duration CEILING = Duration.ofDays(7);

    /** 요청 1건(연결 + 응답 읽기) 제한 시간 */
    @NotNull
    private Duration timeout = Duration.ofSeconds(30);

    @Min(0)
    private int maxRedirects = 5;

    @NotBlank
    private String userAgent = "FeedSync/1.0";

    /** 힌트가 전혀 없을 때 */
    @NotNull
    private Duration defaultInterval = Duration.ofMinutes(60);

    /** 피드 힌트(ttl, sy:updatePeriod) 적용 시 최소 간격 */
    @NotNull
    private Duration minInterval = Duration.ofMinutes(60);

    /** 서버가 Cache-Control 로 직접 알려준 경우의 최소 간격 */
    @NotNull
    private Duration minCacheHintInterval = Duration.ofMinutes(10);

    @NotNull
    private Duration maxInterval = CEILING;

    /** 실패 1회 backoff. n회 실패 시 base * 2^(n-1) */
    @NotNull
    private Duration failureBaseBackoff = Duration.ofMinutes(30);

    /** 이 횟수 이상 연속 실패하면 바로 maxInterval */
    @Min(1)
    private int maxBackoffFailures = 10;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double jitterFraction = 0.1;

    @NotNull
    private Duration maxJitter = Duration.ofMinutes(30);

    /** 같은 origin 에 대한 요청 최소 간격 (기본 1초 = 1 req/s) */
    @NotNull
    private Duration originInterval = Duration.ofSeconds(1);

    /** 301 대상을 url 로 채택하기까지 필요한 연속 관찰 횟수 */
    @Min(1)
    private int redirectConfirmations = 3;
}
