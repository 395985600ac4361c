package com.jimin.reader.service.item;

import com.jimin.reader.dto.ItemResponse;
import com.jimin.reader.dto.ItemVersionResponse;
import com.jimin.reader.entity.Source;
import com.jimin.reader.exception.ItemNotFoundException;
import com.jimin.reader.service.parse.ParsedItem;
import com.jimin.reader.service.reconcile.ItemReconciler;
import com.jimin.reader.support.IntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ItemHistoryServiceTest extends IntegrationTest {

    @Autowired
    private ItemHistoryService itemHistoryService;

    @Autowired
    private ItemReconciler itemReconciler;

    @Test
    void listsItemsAndTheirPreviousVersions() {
        Source source = new Source();
        source.setUrl("https://history.example.com/rss");
        source = sourceRepository.save(source);

        itemReconciler.reconcile(source.getId(), List.of(entry("draft")));
        clock.advance(Duration.ofHours(1));
        itemReconciler.reconcile(source.getId(), List.of(entry("edited")));
        clock.advance(Duration.ofHours(1));
        itemReconciler.reconcile(source.getId(), List.of(entry("final")));

        List<ItemResponse> items = itemHistoryService.getItems(source.getId());
        assertThat(items).singleElement().satisfies(item -> {
            assertThat(item.version()).isEqualTo(3);
            assertThat(item.summary()).isEqualTo("final");
            assertThat(item.sourceId()).isNotNull();
        });

        List<ItemVersionResponse> versions = itemHistoryService.getVersions(items.get(0).id());
        assertThat(versions).extracting(ItemVersionResponse::version).containsExactly(1, 2);
        assertThat(versions).extracting(ItemVersionResponse::content).containsExactly("draft", "edited");
    }

    @Test
    void unknownItemHistory() {
        assertThatThrownBy(() -> itemHistoryService.getVersions(31_337L))
                .isInstanceOf(ItemNotFoundException.class);
    }

    private static ParsedItem entry(String body) {
        return new ParsedItem("guid-1", "https://history.example.com/1", "Post", "jimin", null, body, null);
    }
}
