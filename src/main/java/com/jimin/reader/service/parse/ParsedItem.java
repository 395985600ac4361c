package com.jimin.reader.service.parse;

import java.time.Instant;

/**
 * 피드 entry 1개. 모든 필드는 비어 있을 수 있다
 *
 * @param externalId RSS guid / Atom id
 */
public record ParsedItem(
        String externalId,
        String link,
        String title,
        String author,
        String content,
        String summary,
        Instant publishedAt
) {
}
