package com.jimin.reader.repository;

import com.jimin.reader.entity.UserItemState;
import com.jimin.reader.entity.UserItemStateId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface UserItemStateRepository extends JpaRepository<UserItemState, UserItemStateId> {

    List<UserItemState> findByIdUserIdAndIdItemIdIn(Long userId, Collection<Long> itemIds);

    /**
     * 읽음 상태 조건부 UPDATE
     *
     * read_changed_at < :changedAt 일 때만 반영 → 같은 요청 재전송/순서 뒤바뀐 요청은 no-op
     * @return 반영된 행 수 (0 = 이미 더 최신 값이 있음)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE UserItemState s SET s.read = :value, s.readChangedAt = :changedAt
            WHERE s.id.userId = :userId AND s.id.itemId = :itemId AND s.readChangedAt < :changedAt
            """)
    int updateReadIfNewer(@Param("userId") Long userId, @Param("itemId") Long itemId,
                          @Param("value") boolean value, @Param("changedAt") Instant changedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE UserItemState s SET s.starred = :value, s.starredChangedAt = :changedAt
            WHERE s.id.userId = :userId AND s.id.itemId = :itemId AND s.starredChangedAt < :changedAt
            """)
    int updateStarredIfNewer(@Param("userId") Long userId, @Param("itemId") Long itemId,
                             @Param("value") boolean value, @Param("changedAt") Instant changedAt);
}
