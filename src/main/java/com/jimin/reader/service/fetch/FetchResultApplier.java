package com.jimin.reader.service.fetch;

import com.jimin.reader.entity.JobType;
import com.jimin.reader.entity.Source;
import com.jimin.reader.exception.SourceNotFoundException;
import com.jimin.reader.repository.JobRepository;
import com.jimin.reader.repository.SourceRepository;
import com.jimin.reader.service.job.JobOutcome;
import com.jimin.reader.service.parse.FeedParseException;
import com.jimin.reader.service.parse.FeedParser;
import com.jimin.reader.service.parse.ParsedFeed;
import com.jimin.reader.service.reconcile.ItemReconciler;
import com.jimin.reader.service.reconcile.ReconcileResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * fetch 결과를 Source / Item 에 반영하고 다음 실행 시각을 정한다
 *
 * fetch 가 끝난 뒤 별도 트랜잭션 하나로 실행된다 (파싱, reconcile 포함).
 * 실패도 여기서는 예외가 아니라 JobOutcome.failed 로 돌려준다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class FetchResultApplier {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final SourceRepository sourceRepository;
    private final JobRepository jobRepository;
    private final FeedParser feedParser;
    private final ItemReconciler itemReconciler;
    private final RedirectTracker redirectTracker;
    private final FetchScheduleCalculator scheduleCalculator;
    private final Clock clock;

    public JobOutcome apply(Long sourceId, FetchResult result) {
        Instant now = clock.instant();
        // Why: fetch 중에 구독 해지가 next_fetch_at 을 비웠을 수 있음 → 같은 row lock 으로 순서를 맞춘다
        Source source = sourceRepository.findByIdForUpdate(sourceId)
                .orElseThrow(() -> new SourceNotFoundException(sourceId));
        source.setLastFetchedAt(now);

        JobOutcome outcome = switch (result.status()) {
            case SUCCESS -> applySuccess(source, result, now);
            case NOT_MODIFIED -> applyNotModified(source, result, now);
            case RATE_LIMITED, CLIENT_ERROR, SERVER_ERROR, NETWORK_ERROR, TOO_MANY_REDIRECTS ->
                    applyFailure(source, result, now);
        };

        // 비활성 Job 은 다음 실행이 없으므로 표시용 시각도 비운다 (SubscriptionService 와 같은 규칙)
        boolean enabled = jobRepository.findEnabled(JobType.FETCH_SOURCE, sourceId).orElse(false);
        source.setNextFetchAt(enabled ? outcome.nextRunAt() : null);
        sourceRepository.save(source);
        return outcome;
    }

    private JobOutcome applySuccess(Source source, FetchResult result, Instant now) {
        ParsedFeed feed;
        try {
            feed = feedParser.parse(result.body());
        } catch (FeedParseException e) {
            log.warn("피드 파싱 실패: sourceId={}, url={} - {}", source.getId(), source.getUrl(), e.getMessage());
            return recordFailure(source, "Parse error: " + e.getMessage(), null, now);
        }

        ReconcileResult reconciled = itemReconciler.reconcile(source.getId(), feed.items(), now);

        if (feed.title() != null) {
            source.setTitle(truncate(feed.title(), 500));
        }
        if (feed.description() != null) {
            source.setDescription(feed.description());
        }
        if (feed.siteUrl() != null) {
            source.setSiteUrl(truncate(feed.siteUrl(), 1000));
        }
        source.setHintIntervalSeconds(feed.hintInterval() != null ? feed.hintInterval().toSeconds() : null);
        storeValidators(source, result.cacheHeaders(), true);
        trackRedirect(source, result);
        resetFailures(source);

        NextRun next = scheduleCalculator.afterSuccess(
                result.cacheHeaders().cacheControl(), feed.hintInterval(), now);
        log.info("fetch 성공: sourceId={}, 신규 {} / 변경 {}, 다음 실행 {} ({})",
                source.getId(), reconciled.created(), reconciled.updated(), next.at(), next.reason());
        return JobOutcome.succeeded(next.at());
    }

    private JobOutcome applyNotModified(Source source, FetchResult result, Instant now) {
        storeValidators(source, result.cacheHeaders(), false);
        trackRedirect(source, result);
        resetFailures(source);

        Duration hint = source.getHintIntervalSeconds() != null
                ? Duration.ofSeconds(source.getHintIntervalSeconds())
                : null;
        NextRun next = scheduleCalculator.afterSuccess(result.cacheHeaders().cacheControl(), hint, now);
        log.debug("304 Not Modified: sourceId={}, 다음 실행 {} ({})", source.getId(), next.at(), next.reason());
        return JobOutcome.succeeded(next.at());
    }

    private JobOutcome applyFailure(Source source, FetchResult result, Instant now) {
        String message = result.message() != null ? result.message() : result.status().name();
        log.warn("fetch 실패: sourceId={}, url={}, status={} - {}",
                source.getId(), source.getUrl(), result.status(), message);
        return recordFailure(source, message, result.retryAfter(), now);
    }

    private JobOutcome recordFailure(Source source, String message, Duration retryAfter, Instant now) {
        int failures = source.getConsecutiveFailures() + 1;
        source.setConsecutiveFailures(failures);
        source.setLastError(truncate(message, MAX_ERROR_LENGTH));

        NextRun next = retryAfter != null
                ? scheduleCalculator.afterRetryAfter(retryAfter, now)
                : scheduleCalculator.afterFailure(failures, now);
        return JobOutcome.failed(next.at(), source.getLastError());
    }

    /**
     * 200 이면 validator 를 응답 값으로 교체 (없으면 비움), 304 면 새로 온 값만 갱신
     */
    private void storeValidators(Source source, CacheHeaders headers, boolean replace) {
        if (replace || headers.etag() != null) {
            source.setEtag(truncate(headers.etag(), 500));
        }
        if (replace || headers.lastModified() != null) {
            source.setLastModifiedHeader(truncate(headers.lastModified(), 100));
        }
    }

    private void trackRedirect(Source source, FetchResult result) {
        Optional<String> adopted = redirectTracker.observe(source, result.permanentRedirectTarget());
        if (adopted.isEmpty()) {
            return;
        }
        String newUrl = adopted.get();
        if (sourceRepository.existsByUrl(newUrl)) {
            // 이미 다른 Source 가 쓰는 URL → 합치지 않고 기존 URL 유지
            log.warn("redirect 대상 URL 이 이미 다른 소스에 있음, 변경 안 함: sourceId={}, {} → {}",
                    source.getId(), source.getUrl(), newUrl);
            return;
        }
        log.info("소스 URL 변경: sourceId={}, {} → {}", source.getId(), source.getUrl(), newUrl);
        source.setUrl(newUrl);
    }

    private void resetFailures(Source source) {
        source.setConsecutiveFailures(0);
        source.setLastError(null);
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
