package com.jimin.reader.service.reconcile;

import com.jimin.reader.entity.Item;
import com.jimin.reader.entity.ItemVersion;
import com.jimin.reader.entity.Source;
import com.jimin.reader.entity.Subscription;
import com.jimin.reader.entity.UserItemState;
import com.jimin.reader.event.EventBus;
import com.jimin.reader.event.ItemEvent;
import com.jimin.reader.exception.SourceNotFoundException;
import com.jimin.reader.repository.ItemRepository;
import com.jimin.reader.repository.ItemVersionRepository;
import com.jimin.reader.repository.SourceRepository;
import com.jimin.reader.repository.SubscriptionRepository;
import com.jimin.reader.repository.UserItemStateRepository;
import com.jimin.reader.service.parse.ParsedItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 파싱된 entry 목록 → Item 테이블 반영
 *
 * 동작 방식:
 * 1. (source, dedupe key) 로 기존 Item 조회
 * 2. 없으면 version 1 로 생성 + 활성 구독자마다 안 읽음 상태 생성
 * 3. 있는데 fingerprint 가 같으면 아무것도 안 함
 * 4. fingerprint 가 다르면 이전 내용을 ItemVersion 으로 보관하고 제자리 수정 (version + 1)
 *
 * Item 은 절대 삭제하지 않는다. 피드에서 사라진 entry 도 그대로 남는다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class ItemReconciler {

    private static final int SUMMARY_MAX_LENGTH = 300;
    private static final int MAX_TEXT_LENGTH = 1000;
    private static final int MAX_AUTHOR_LENGTH = 300;

    private final SourceRepository sourceRepository;
    private final ItemRepository itemRepository;
    private final ItemVersionRepository itemVersionRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final UserItemStateRepository userItemStateRepository;
    private final EventBus eventBus;
    private final Clock clock;

    public ReconcileResult reconcile(Long sourceId, List<ParsedItem> items) {
        return reconcile(sourceId, items, clock.instant());
    }

    public ReconcileResult reconcile(Long sourceId, List<ParsedItem> items, Instant fetchedAt) {
        Source source = sourceRepository.findById(sourceId)
                .orElseThrow(() -> new SourceNotFoundException(sourceId));

        int created = 0;
        int updated = 0;
        int unchanged = 0;
        int skipped = 0;
        List<Subscription> subscribers = null;

        for (ParsedItem parsed : items) {
            String dedupeKey = ItemFingerprint.dedupeKey(parsed);
            if (dedupeKey == null) {
                log.warn("식별 키 없는 entry 건너뜀: sourceId={}", sourceId);
                skipped++;
                continue;
            }
            String hash = ItemFingerprint.contentHash(parsed);

            Optional<Item> existing = itemRepository.findBySourceIdAndDedupeKey(sourceId, dedupeKey);
            if (existing.isEmpty()) {
                if (subscribers == null) {
                    subscribers = subscriptionRepository.findBySourceIdAndActiveTrue(sourceId);
                }
                Item item = create(source, parsed, dedupeKey, hash, fetchedAt);
                for (Subscription subscription : subscribers) {
                    userItemStateRepository.save(
                            UserItemState.unread(subscription.getUserId(), item.getId(), fetchedAt));
                }
                eventBus.publish(EventBus.ITEM_CREATED, new ItemEvent(sourceId, item.getId(), item.getVersion()));
                created++;
                continue;
            }

            Item item = existing.get();
            if (hash.equals(item.getContentHash())) {
                unchanged++;
                continue;
            }

            archive(item, fetchedAt);
            apply(item, parsed, hash, fetchedAt);
            item.setVersion(item.getVersion() + 1);
            itemRepository.save(item);
            log.debug("Item 변경: itemId={}, version={}", item.getId(), item.getVersion());
            eventBus.publish(EventBus.ITEM_UPDATED, new ItemEvent(sourceId, item.getId(), item.getVersion()));
            updated++;
        }

        ReconcileResult result = new ReconcileResult(created, updated, unchanged, skipped);
        log.info("reconcile 완료: sourceId={}, 신규 {}, 변경 {}, 동일 {}, 건너뜀 {}",
                sourceId, created, updated, unchanged, skipped);
        return result;
    }

    private Item create(Source source, ParsedItem parsed, String dedupeKey, String hash, Instant fetchedAt) {
        Item item = new Item();
        item.setSource(source);
        item.setDedupeKey(dedupeKey);
        item.setVersion(1);
        item.setFirstSeenAt(fetchedAt);
        apply(item, parsed, hash, fetchedAt);
        return itemRepository.save(item);
    }

    private void apply(Item item, ParsedItem parsed, String hash, Instant fetchedAt) {
        // Why: 컬럼보다 긴 값 하나가 트랜잭션 전체를 롤백시키지 않게 잘라서 저장
        item.setExternalId(truncate(parsed.externalId(), MAX_TEXT_LENGTH));
        item.setUrl(truncate(parsed.link(), MAX_TEXT_LENGTH));
        item.setTitle(truncate(parsed.title(), MAX_TEXT_LENGTH));
        item.setAuthor(truncate(parsed.author(), MAX_AUTHOR_LENGTH));
        item.setContent(parsed.content() != null ? parsed.content() : parsed.summary());
        item.setSummary(summarize(parsed.summary() != null ? parsed.summary() : parsed.content()));
        item.setPublishedAt(parsed.publishedAt() != null ? parsed.publishedAt() : item.getFirstSeenAt());
        item.setContentHash(hash);
        item.setUpdatedAt(fetchedAt);
    }

    // 현재 내용을 이력으로 보관 (덮어쓰기 전에 호출)
    private void archive(Item item, Instant archivedAt) {
        ItemVersion version = new ItemVersion();
        version.setItem(item);
        version.setVersion(item.getVersion());
        version.setTitle(item.getTitle());
        version.setContent(item.getContent());
        version.setContentHash(item.getContentHash());
        version.setArchivedAt(archivedAt);
        itemVersionRepository.save(version);
    }

    /**
     * HTML 태그 제거 후 앞부분만
     * Why: RSS description 에 <p>, <a> 등 HTML 태그가 포함되어 있음
     */
    static String summarize(String html) {
        if (html == null) {
            return null;
        }
        String text = html.replaceAll("<[^>]*>", "").replaceAll("\\s+", " ").trim();
        if (text.length() <= SUMMARY_MAX_LENGTH) {
            return text;
        }
        return text.substring(0, SUMMARY_MAX_LENGTH).trim() + "…";
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
