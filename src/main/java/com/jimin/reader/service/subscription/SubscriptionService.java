package com.jimin.reader.service.subscription;

import com.jimin.reader.dto.SubscriptionResponse;
import com.jimin.reader.entity.Job;
import com.jimin.reader.entity.Source;
import com.jimin.reader.entity.Subscription;
import com.jimin.reader.event.EventBus;
import com.jimin.reader.event.SubscriptionEvent;
import com.jimin.reader.exception.SourceNotFoundException;
import com.jimin.reader.exception.SubscriptionNotFoundException;
import com.jimin.reader.repository.SourceRepository;
import com.jimin.reader.repository.SubscriptionRepository;
import com.jimin.reader.service.job.JobLifecycleService;
import com.jimin.reader.service.job.JobQueueService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * 구독 / 구독 해지
 *
 * 동작 방식:
 * 1. 소스 row 에 PESSIMISTIC_WRITE lock → 같은 소스에 대한 구독/해지가 한 줄로 선다
 * 2. Subscription 활성화 또는 비활성화
 * 3. (구독 시) fetch Job 을 찾거나 만들고 enabled
 * 4. JobLifecycleService.syncEnabled 로 Job.enabled 를 활성 구독자 존재 여부와 맞춤
 * 5. Source.next_fetch_at 표시값 갱신 (Job 이 꺼지면 null)
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class SubscriptionService {

    private final SourceRepository sourceRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final JobQueueService jobQueueService;
    private final JobLifecycleService jobLifecycleService;
    private final EventBus eventBus;
    private final Clock clock;

    /**
     * URL 로 구독 (소스가 없으면 생성). 이미 구독 중이면 그대로 둔다 (멱등)
     */
    public SubscriptionResponse subscribe(Long userId, String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("구독할 URL 이 비어 있습니다.");
        }
        String normalized = url.trim();
        Instant now = clock.instant();

        Source source = sourceRepository.findByUrl(normalized)
                .orElseGet(() -> createSource(normalized));
        Long sourceId = source.getId();
        lockSource(sourceId);

        Subscription subscription = subscriptionRepository.findByUserIdAndSourceId(userId, sourceId)
                .orElseGet(() -> newSubscription(userId, sourceId));
        if (subscription.getId() == null || !subscription.isActive()) {
            subscription.setActive(true);
            subscription.setSubscribedAt(now);
            subscription.setUnsubscribedAt(null);
            subscription = subscriptionRepository.saveAndFlush(subscription);
            log.info("구독: userId={}, sourceId={}, url={}", userId, sourceId, normalized);
        }

        jobQueueService.ensureFetchJob(sourceId);
        boolean enabled = jobLifecycleService.syncEnabled(sourceId);
        Source refreshed = refreshNextFetch(sourceId, enabled);

        eventBus.publish(EventBus.SUBSCRIPTION_CREATED, new SubscriptionEvent(userId, sourceId, enabled));
        return SubscriptionResponse.from(subscription, refreshed, enabled);
    }

    /**
     * 구독 해지. 마지막 구독자가 빠지면 fetch Job 이 disabled 된다 (삭제하지 않음)
     *
     * @throws SubscriptionNotFoundException 활성 구독이 없을 때
     */
    public SubscriptionResponse unsubscribe(Long userId, Long sourceId) {
        Instant now = clock.instant();
        lockSource(sourceId);

        Subscription subscription = subscriptionRepository.findByUserIdAndSourceId(userId, sourceId)
                .filter(Subscription::isActive)
                .orElseThrow(() -> new SubscriptionNotFoundException(userId, sourceId));
        subscription.setActive(false);
        subscription.setUnsubscribedAt(now);
        subscription = subscriptionRepository.saveAndFlush(subscription);

        boolean enabled = jobLifecycleService.syncEnabled(sourceId);
        Source refreshed = refreshNextFetch(sourceId, enabled);
        log.info("구독 해지: userId={}, sourceId={}, jobEnabled={}", userId, sourceId, enabled);

        eventBus.publish(EventBus.SUBSCRIPTION_REMOVED, new SubscriptionEvent(userId, sourceId, enabled));
        return SubscriptionResponse.from(subscription, refreshed, enabled);
    }

    private Source createSource(String url) {
        Source source = new Source();
        source.setUrl(url);
        Source saved = sourceRepository.saveAndFlush(source);
        log.info("소스 생성: sourceId={}, url={}", saved.getId(), url);
        return saved;
    }

    private Subscription newSubscription(Long userId, Long sourceId) {
        Subscription subscription = new Subscription();
        subscription.setUserId(userId);
        subscription.setSourceId(sourceId);
        return subscription;
    }

    private void lockSource(Long sourceId) {
        sourceRepository.findByIdForUpdate(sourceId)
                .orElseThrow(() -> new SourceNotFoundException(sourceId));
    }

    /**
     * syncEnabled 의 UPDATE 가 영속성 컨텍스트를 비우므로 소스를 다시 읽어서 갱신한다
     */
    private Source refreshNextFetch(Long sourceId, boolean enabled) {
        Source source = sourceRepository.findById(sourceId)
                .orElseThrow(() -> new SourceNotFoundException(sourceId));
        Instant nextFetchAt = null;
        if (enabled) {
            nextFetchAt = jobQueueService.findFetchJob(sourceId)
                    .map(Job::getNextRunAt)
                    .orElse(null);
        }
        source.setNextFetchAt(nextFetchAt);
        return sourceRepository.saveAndFlush(source);
    }

    @Transactional(readOnly = true)
    public Optional<Subscription> findActive(Long userId, Long sourceId) {
        return subscriptionRepository.findByUserIdAndSourceId(userId, sourceId)
                .filter(Subscription::isActive);
    }
}
