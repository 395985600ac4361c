package com.jimin.reader.service.reconcile;

import com.jimin.reader.entity.Item;
import com.jimin.reader.entity.ItemVersion;
import com.jimin.reader.entity.Source;
import com.jimin.reader.entity.Subscription;
import com.jimin.reader.entity.UserItemState;
import com.jimin.reader.entity.UserItemStateId;
import com.jimin.reader.event.EventBus;
import com.jimin.reader.event.ItemEvent;
import com.jimin.reader.service.parse.ParsedItem;
import com.jimin.reader.support.IntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ItemReconcilerTest extends IntegrationTest {

    @Autowired
    private ItemReconciler reconciler;

    private Source source;

    @BeforeEach
    void setUp() {
        source = new Source();
        source.setUrl("https://news.example.com/rss");
        source = sourceRepository.save(source);
    }

    @Test
    void createsNewItemsWithVersionOne() {
        Instant fetchedAt = clock.instant();

        ReconcileResult result = reconciler.reconcile(source.getId(), List.of(
                item("guid-1", "https://news.example.com/1", "One", "<p>first</p>"),
                item("guid-2", "https://news.example.com/2", "Two", "second")), fetchedAt);

        assertThat(result).isEqualTo(new ReconcileResult(2, 0, 0, 0));
        List<Item> items = itemRepository.findBySourceIdOrderByFirstSeenAtDesc(source.getId());
        assertThat(items).hasSize(2).allSatisfy(item -> {
            assertThat(item.getVersion()).isEqualTo(1);
            assertThat(item.getFirstSeenAt()).isEqualTo(fetchedAt);
            assertThat(item.getContentHash()).hasSize(64);
        });
        assertThat(events.topics()).containsExactly(EventBus.ITEM_CREATED, EventBus.ITEM_CREATED);
    }

    @Test
    void sameContentIsNoOp() {
        List<ParsedItem> feed = List.of(item("guid-1", "https://news.example.com/1", "One", "body"));
        reconciler.reconcile(source.getId(), feed);
        events.clear();

        clock.advance(Duration.ofHours(1));
        ReconcileResult result = reconciler.reconcile(source.getId(), feed);

        assertThat(result).isEqualTo(new ReconcileResult(0, 0, 1, 0));
        Item item = itemRepository.findBySourceIdAndDedupeKey(source.getId(), "guid-1").orElseThrow();
        assertThat(item.getVersion()).isEqualTo(1);
        assertThat(item.getUpdatedAt()).isEqualTo(item.getFirstSeenAt());
        assertThat(itemVersionRepository.countByItemId(item.getId())).isZero();
        assertThat(events.topics()).isEmpty();
    }

    @Test
    void changedContentArchivesPreviousVersion() {
        reconciler.reconcile(source.getId(), List.of(item("guid-1", "https://news.example.com/1", "One", "v1 body")));
        Item original = itemRepository.findBySourceIdAndDedupeKey(source.getId(), "guid-1").orElseThrow();
        events.clear();

        clock.advance(Duration.ofHours(2));
        ReconcileResult result = reconciler.reconcile(source.getId(),
                List.of(item("guid-1", "https://news.example.com/1", "One (edited)", "v2 body")));

        assertThat(result.updated()).isEqualTo(1);
        Item updated = itemRepository.findById(original.getId()).orElseThrow();
        assertThat(updated.getVersion()).isEqualTo(2);
        assertThat(updated.getTitle()).isEqualTo("One (edited)");
        assertThat(updated.getContentHash()).isNotEqualTo(original.getContentHash());
        assertThat(updated.getFirstSeenAt()).isEqualTo(original.getFirstSeenAt());

        List<ItemVersion> history = itemVersionRepository.findByItemIdOrderByVersionAsc(original.getId());
        assertThat(history).hasSize(1);
        assertThat(history.get(0).getVersion()).isEqualTo(1);
        assertThat(history.get(0).getTitle()).isEqualTo("One");
        assertThat(history.get(0).getContent()).isEqualTo("v1 body");
        assertThat(history.get(0).getContentHash()).isEqualTo(original.getContentHash());

        assertThat(events.events()).singleElement().satisfies(event -> {
            assertThat(event.topic()).isEqualTo(EventBus.ITEM_UPDATED);
            assertThat(event.payload()).isEqualTo(new ItemEvent(source.getId(), original.getId(), 2));
        });
    }

    @Test
    void fallsBackToLinkThenTitleAndSkipsUnidentifiable() {
        ReconcileResult result = reconciler.reconcile(source.getId(), List.of(
                item(null, "https://news.example.com/no-guid", "Linked", "a"),
                item(null, null, "Only title", "b"),
                item(null, null, null, "nothing to identify")));

        assertThat(result).isEqualTo(new ReconcileResult(2, 0, 0, 1));
        assertThat(itemRepository.findBySourceIdAndDedupeKey(source.getId(), "https://news.example.com/no-guid")).isPresent();
        assertThat(itemRepository.findBySourceIdAndDedupeKey(source.getId(), "Only title")).isPresent();
    }

    @Test
    void overlongFieldsAreStoredWithoutLosingSiblings() {
        String longGuid = "urn:guid:" + "g".repeat(1500);
        ParsedItem huge = new ParsedItem(longGuid, "https://news.example.com/" + "p".repeat(1500),
                "T".repeat(1500), "A".repeat(500), "body", null, null);
        List<ParsedItem> feed = List.of(item("guid-ok", null, "Fine", "ok"), huge);

        ReconcileResult first = reconciler.reconcile(source.getId(), feed);
        ReconcileResult second = reconciler.reconcile(source.getId(), feed);

        assertThat(first).isEqualTo(new ReconcileResult(2, 0, 0, 0));
        assertThat(second).isEqualTo(new ReconcileResult(0, 0, 2, 0));
        assertThat(itemRepository.findBySourceIdAndDedupeKey(source.getId(), "guid-ok")).isPresent();

        Item stored = itemRepository.findBySourceIdOrderByFirstSeenAtDesc(source.getId()).stream()
                .filter(item -> !item.getDedupeKey().equals("guid-ok"))
                .findFirst().orElseThrow();
        assertThat(stored.getDedupeKey()).startsWith("sha256:").hasSizeLessThanOrEqualTo(ItemFingerprint.MAX_KEY_LENGTH);
        assertThat(stored.getTitle()).hasSize(1000);
        assertThat(stored.getExternalId()).hasSize(1000);
        assertThat(stored.getUrl()).hasSize(1000);
        assertThat(stored.getAuthor()).hasSize(300);
    }

    @Test
    void itemsDisappearingFromFeedAreKept() {
        reconciler.reconcile(source.getId(), List.of(item("guid-1", null, "One", "a")));
        reconciler.reconcile(source.getId(), List.of(item("guid-2", null, "Two", "b")));

        assertThat(itemRepository.countBySourceId(source.getId())).isEqualTo(2);
    }

    @Test
    void newItemsGetUnreadStateForActiveSubscribers() {
        subscribe(10L, true);
        subscribe(11L, false);
        Instant fetchedAt = clock.instant();

        reconciler.reconcile(source.getId(), List.of(item("guid-1", null, "One", "a")), fetchedAt);

        Item item = itemRepository.findBySourceIdAndDedupeKey(source.getId(), "guid-1").orElseThrow();
        UserItemState state = userItemStateRepository.findById(new UserItemStateId(10L, item.getId())).orElseThrow();
        assertThat(state.isRead()).isFalse();
        assertThat(state.isStarred()).isFalse();
        assertThat(state.getReadChangedAt()).isEqualTo(fetchedAt);
        assertThat(userItemStateRepository.findById(new UserItemStateId(11L, item.getId()))).isEmpty();
    }

    @Test
    void summaryIsPlainTextAndShort() {
        String longHtml = "<p>" + "word ".repeat(200) + "</p>";

        String summary = ItemReconciler.summarize(longHtml);

        assertThat(summary).doesNotContain("<p>").startsWith("word word");
        assertThat(summary.length()).isLessThanOrEqualTo(301);
    }

    private void subscribe(Long userId, boolean active) {
        Subscription subscription = new Subscription();
        subscription.setUserId(userId);
        subscription.setSourceId(source.getId());
        subscription.setActive(active);
        subscription.setSubscribedAt(clock.instant());
        subscriptionRepository.save(subscription);
    }

    private static ParsedItem item(String guid, String link, String title, String content) {
        return new ParsedItem(guid, link, title, null, content, null, null);
    }
}
