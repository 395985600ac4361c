package com.jimin.reader.dto;

import com.jimin.reader.entity.UserItemState;

import java.time.Instant;

/**
 * 상태 변경 요청 결과 / 상태 조회 응답
 *
 * 변경이 무시된 경우(더 최신 값이 이미 있음)에도 현재 저장된 값을 그대로 돌려준다.
 *
 * @param changed 이번 요청으로 실제 값이 바뀌었는지
 */
public record ItemStateResponse(
        Long itemId,
        boolean read,
        boolean starred,
        Instant readChangedAt,
        Instant starredChangedAt,
        boolean changed
) {
    public static ItemStateResponse from(UserItemState state, boolean changed) {
        return new ItemStateResponse(
                state.getId().getItemId(),
                state.isRead(),
                state.isStarred(),
                state.getReadChangedAt(),
                state.getStarredChangedAt(),
                changed
        );
    }
}
