package com.jimin.reader.dto;

import com.jimin.reader.entity.Source;

import java.time.Instant;

/**
 * 실패 중인 소스 목록 응답 DTO
 */
public record SourceHealthResponse(
        Long sourceId,
        String url,
        String title,
        int consecutiveFailures,
        String lastError,
        Instant lastFetchedAt,
        Instant nextFetchAt
) {
    public static SourceHealthResponse from(Source source) {
        return new SourceHealthResponse(
                source.getId(),
                source.getUrl(),
                source.getTitle(),
                source.getConsecutiveFailures(),
                source.getLastError(),
                source.getLastFetchedAt(),
                source.getNextFetchAt()
        );
    }
}
