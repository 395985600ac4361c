package com.jimin.reader.service.state;

import com.jimin.reader.dto.ItemStateResponse;
import com.jimin.reader.entity.Item;
import com.jimin.reader.entity.UserItemState;
import com.jimin.reader.event.EventBus;
import com.jimin.reader.event.ItemStateEvent;
import com.jimin.reader.exception.ItemNotFoundException;
import com.jimin.reader.repository.ItemRepository;
import com.jimin.reader.repository.UserItemStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 사용자별 읽음/별표 상태 병합
 *
 * 규칙: 필드마다 last-writer-wins.
 * 요청의 changedAt 이 저장된 변경 시각보다 "엄격하게" 클 때만 반영한다.
 * → 같은 요청을 여러 번 보내도 결과가 같고 (멱등), 늦게 도착한 오래된 요청은 무시된다.
 *
 * 비교 기준은 클라이언트가 보낸 시각이라 기기 간 시계 차이만큼 순서가 틀릴 수 있다. 감수한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ItemStateService {

    private final UserItemStateStore store;
    private final ItemRepository itemRepository;
    private final UserItemStateRepository stateRepository;
    private final EventBus eventBus;
    private final Clock clock;

    /**
     * 단건 변경
     *
     * @param changedAt 변경 시각. null 이면 지금
     * @return 현재 저장된 상태 + 이번 요청으로 바뀌었는지
     * @throws ItemNotFoundException 존재하지 않는 Item
     */
    public ItemStateResponse applyState(Long userId, Long itemId, StateField field,
                                        boolean value, Instant changedAt) {
        Instant effectiveAt = changedAt != null ? changedAt : clock.instant();
        ensureState(userId, itemId);

        boolean changed = store.writeIfNewer(userId, itemId, field, value, effectiveAt);
        if (!changed) {
            log.debug("상태 변경 무시 (더 최신 값 있음): userId={}, itemId={}, {}={}, changedAt={}",
                    userId, itemId, field, value, effectiveAt);
        }

        UserItemState state = store.find(userId, itemId)
                .orElseThrow(() -> new IllegalStateException(
                        "상태 row 가 사라짐: userId=" + userId + ", itemId=" + itemId));
        if (changed) {
            eventBus.publish(EventBus.ITEM_STATE_CHANGED, new ItemStateEvent(userId, itemId,
                    state.isRead(), state.isStarred(), state.getReadChangedAt(), state.getStarredChangedAt()));
        }
        return ItemStateResponse.from(state, changed);
    }

    /**
     * 일괄 변경 (예: "모두 읽음")
     *
     * 항목마다 단건과 같은 규칙을 적용하고, 요청한 모든 Item 의 현재 상태를 요청 순서대로 돌려준다.
     * 항목 하나가 무시돼도 나머지는 그대로 반영된다.
     * 존재하지 않는 Item 은 쓰기 전에 걸러내고 결과에서도 빠진다 (getState 와 같음).
     */
    public List<ItemStateResponse> applyStateBatch(Long userId, StateField field, boolean value,
                                                   List<ItemStateChange> changes) {
        Instant now = clock.instant();
        Set<Long> knownIds = itemRepository.findAllById(
                        changes.stream().map(ItemStateChange::itemId).toList())
                .stream()
                .map(Item::getId)
                .collect(Collectors.toSet());

        List<ItemStateResponse> responses = new ArrayList<>(changes.size());
        for (ItemStateChange change : changes) {
            if (!knownIds.contains(change.itemId())) {
                log.debug("없는 Item 건너뜀: userId={}, itemId={}", userId, change.itemId());
                continue;
            }
            Instant changedAt = change.changedAt() != null ? change.changedAt() : now;
            responses.add(applyState(userId, change.itemId(), field, value, changedAt));
        }
        long changedCount = responses.stream().filter(ItemStateResponse::changed).count();
        log.debug("상태 일괄 변경: userId={}, {}={}, 요청 {}건 / 반영 {}건",
                userId, field, value, changes.size(), changedCount);
        return responses;
    }

    /**
     * 상태 조회 (읽기 전용)
     *
     * row 가 아직 없는 Item 은 기본값(안 읽음, first_seen_at)으로 채운다. 존재하지 않는 Item 은 결과에서 빠진다.
     */
    @Transactional(readOnly = true)
    public List<ItemStateResponse> getState(Long userId, Collection<Long> itemIds) {
        Map<Long, UserItemState> stored = stateRepository.findByIdUserIdAndIdItemIdIn(userId, itemIds)
                .stream()
                .collect(Collectors.toMap(s -> s.getId().getItemId(), Function.identity()));
        Map<Long, Item> items = itemRepository.findAllById(itemIds)
                .stream()
                .collect(Collectors.toMap(Item::getId, Function.identity()));

        List<ItemStateResponse> responses = new ArrayList<>();
        for (Long itemId : itemIds) {
            UserItemState state = stored.get(itemId);
            if (state == null) {
                Item item = items.get(itemId);
                if (item == null) {
                    continue;
                }
                state = UserItemState.unread(userId, itemId, item.getFirstSeenAt());
            }
            responses.add(ItemStateResponse.from(state, false));
        }
        return responses;
    }

    private void ensureState(Long userId, Long itemId) {
        try {
            if (store.createIfAbsent(userId, itemId)) {
                log.debug("상태 row 생성: userId={}, itemId={}", userId, itemId);
            }
        } catch (DataIntegrityViolationException e) {
            // 같은 (user, item) 을 다른 요청이 먼저 만들었음 → 이미 있으니 그대로 진행
            log.debug("상태 row 동시 생성: userId={}, itemId={}", userId, itemId);
        }
    }
}
