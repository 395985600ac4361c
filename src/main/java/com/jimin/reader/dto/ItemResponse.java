package com.jimin.reader.dto;

import com.jimin.reader.entity.Item;

import java.time.Instant;

/**
 * Item 응답 DTO
 *
 * Entity 를 직접 노출하지 않고 필요한 필드만 전달 (content 는 제외, summary 만)
 */
public record ItemResponse(
        Long id,
        Long sourceId,
        String title,
        String url,
        String author,
        String summary,
        Instant publishedAt,
        int version,
        Instant firstSeenAt,
        Instant updatedAt
) {
    public static ItemResponse from(Item item) {
        return new ItemResponse(
                item.getId(),
                item.getSource().getId(),
                item.getTitle(),
                item.getUrl(),
                item.getAuthor(),
                item.getSummary(),
                item.getPublishedAt(),
                item.getVersion(),
                item.getFirstSeenAt(),
                item.getUpdatedAt()
        );
    }
}
