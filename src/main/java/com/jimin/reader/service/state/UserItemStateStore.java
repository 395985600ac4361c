package com.jimin.reader.service.state;

import com.jimin.reader.entity.Item;
import com.jimin.reader.entity.UserItemState;
import com.jimin.reader.entity.UserItemStateId;
import com.jimin.reader.exception.ItemNotFoundException;
import com.jimin.reader.repository.ItemRepository;
import com.jimin.reader.repository.UserItemStateRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * user_item_states 단건 트랜잭션 모음
 *
 * ItemStateService 가 "없으면 생성"과 "조건부 쓰기"를 각각 짧은 트랜잭션으로 나눠 호출한다.
 * Why: 동시 생성으로 insert 가 충돌해도 그 트랜잭션만 롤백되고 쓰기는 그대로 진행할 수 있게
 */
@Component
@RequiredArgsConstructor
public class UserItemStateStore {

    private final ItemRepository itemRepository;
    private final UserItemStateRepository stateRepository;
    private final Clock clock;

    /**
     * 상태 row 가 없으면 "안 읽음/별표 없음"으로 생성
     *
     * 두 변경 시각은 Item 의 first_seen_at 으로 둔다 → 이후 어떤 실제 변경도 이 값보다 늦다.
     *
     * @return 새로 만들었으면 true
     * @throws ItemNotFoundException Item 이 없을 때
     */
    @Transactional
    public boolean createIfAbsent(Long userId, Long itemId) {
        Item item = itemRepository.findById(itemId)
                .orElseThrow(() -> new ItemNotFoundException(itemId));
        if (stateRepository.existsById(new UserItemStateId(userId, itemId))) {
            return false;
        }
        UserItemState state = UserItemState.unread(userId, itemId, item.getFirstSeenAt());
        state.setCreatedAt(clock.instant());
        stateRepository.saveAndFlush(state);
        return true;
    }

    /**
     * changedAt 이 저장된 변경 시각보다 클 때만 반영
     * @return 반영됐으면 true
     */
    @Transactional
    public boolean writeIfNewer(Long userId, Long itemId, StateField field, boolean value, Instant changedAt) {
        int updated = switch (field) {
            case READ -> stateRepository.updateReadIfNewer(userId, itemId, value, changedAt);
            case STARRED -> stateRepository.updateStarredIfNewer(userId, itemId, value, changedAt);
        };
        return updated > 0;
    }

    @Transactional(readOnly = true)
    public Optional<UserItemState> find(Long userId, Long itemId) {
        return stateRepository.findById(new UserItemStateId(userId, itemId));
    }
}
