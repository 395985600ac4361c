package com.jimin.reader.service.fetch;

import com.jimin.reader.config.FetchProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 다음 fetch 시각 계산
 *
 * 우선순위:
 * 1. 연속 실패 → 지수 backoff (30분, 1시간, 2시간 ... maxBackoffFailures 회 이상이면 최대값)
 * 2. Cache-Control s-maxage / max-age (하한 minCacheHintInterval)
 * 3. 피드 힌트 (<ttl>, sy:updatePeriod) (하한 minInterval)
 * 4. 기본값 defaultInterval
 *
 * 여기에 최대 10%(최대 30분) jitter 를 더한 뒤 [1분, 7일] 로 자른다.
 */
@Component
public class FetchScheduleCalculator {

    private final FetchProperties properties;
    private final DoubleSupplier randomSource;

    @Autowired
    public FetchScheduleCalculator(FetchProperties properties) {
        this(properties, () -> ThreadLocalRandom.current().nextDouble());
    }

    FetchScheduleCalculator(FetchProperties properties, DoubleSupplier randomSource) {
        this.properties = properties;
        this.randomSource = randomSource;
    }

    /**
     * 200 / 304 이후
     *
     * @param hintInterval 피드 힌트에서 얻은 주기 (없으면 null)
     */
    public NextRun afterSuccess(CacheControl cacheControl, Duration hintInterval, Instant now) {
        Duration interval;
        NextRun.Reason reason;

        Duration maxAge = cacheControl != null ? cacheControl.effectiveMaxAge().orElse(null) : null;
        if (maxAge != null) {
            Duration min = properties.getMinCacheHintInterval();
            if (maxAge.compareTo(min) < 0) {
                interval = min;
                reason = NextRun.Reason.CACHE_CONTROL_CLAMPED_MIN;
            } else if (maxAge.compareTo(maxInterval()) > 0) {
                interval = maxInterval();
                reason = NextRun.Reason.CACHE_CONTROL_CLAMPED_MAX;
            } else {
                interval = maxAge;
                reason = NextRun.Reason.CACHE_CONTROL;
            }
        } else if (hintInterval != null && hintInterval.compareTo(Duration.ZERO) > 0) {
            Duration min = properties.getMinInterval();
            if (hintInterval.compareTo(min) < 0) {
                interval = min;
                reason = NextRun.Reason.FEED_HINT_CLAMPED_MIN;
            } else if (hintInterval.compareTo(maxInterval()) > 0) {
                interval = maxInterval();
                reason = NextRun.Reason.FEED_HINT_CLAMPED_MAX;
            } else {
                interval = hintInterval;
                reason = NextRun.Reason.FEED_HINT;
            }
        } else {
            interval = properties.getDefaultInterval();
            reason = NextRun.Reason.DEFAULT;
        }
        return schedule(now, interval.plus(jitter(interval)), reason);
    }

    /**
     * 실패 이후
     *
     * @param consecutiveFailures 이번 실패를 포함한 연속 실패 횟수 (1 이상)
     */
    public NextRun afterFailure(int consecutiveFailures, Instant now) {
        Duration backoff = failureBackoff(consecutiveFailures);
        return schedule(now, backoff.plus(jitter(backoff)), NextRun.Reason.FAILURE_BACKOFF);
    }

    /**
     * 429 + Retry-After. 서버가 알려준 시각을 그대로 따른다 (jitter 없음)
     */
    public NextRun afterRetryAfter(Duration retryAfter, Instant now) {
        return schedule(now, retryAfter, NextRun.Reason.RETRY_AFTER);
    }

    /**
     * base * 2^(n-1), maxBackoffFailures 회 이상이면 최대 간격
     */
    public Duration failureBackoff(int consecutiveFailures) {
        int failures = Math.max(1, consecutiveFailures);
        if (failures >= properties.getMaxBackoffFailures()) {
            return maxInterval();
        }
        Duration max = maxInterval();
        Duration backoff = properties.getFailureBaseBackoff();
        for (int i = 1; i < failures; i++) {
            backoff = backoff.multipliedBy(2);
            if (backoff.compareTo(max) >= 0) {
                return max;
            }
        }
        return backoff;
    }

    Duration jitter(Duration interval) {
        double fraction = properties.getJitterFraction();
        if (fraction <= 0) {
            return Duration.ZERO;
        }
        long maxJitterMillis = Math.min(
                (long) (interval.toMillis() * fraction),
                properties.getMaxJitter().toMillis());
        return Duration.ofMillis((long) (maxJitterMillis * randomSource.getAsDouble()));
    }

    private NextRun schedule(Instant now, Duration interval, NextRun.Reason reason) {
        Duration bounded = bound(interval);
        return new NextRun(now.plus(bounded), bounded, reason);
    }

    private Duration bound(Duration interval) {
        if (interval.compareTo(FetchProperties.FLOOR) < 0) {
            return FetchProperties.FLOOR;
        }
        Duration max = maxInterval();
        return interval.compareTo(max) > 0 ? max : interval;
    }

    private Duration maxInterval() {
        Duration configured = properties.getMaxInterval();
        return configured.compareTo(FetchProperties.CEILING) > 0 ? FetchProperties.CEILING : configured;
    }
}
