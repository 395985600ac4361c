package com.jimin.reader.service.state;

import java.time.Instant;

/**
 * 일괄 변경의 한 항목
 *
 * @param changedAt 클라이언트에서 변경이 일어난 시각. null 이면 서버 수신 시각
 */
public record ItemStateChange(
        Long itemId,
        Instant changedAt
) {
}
