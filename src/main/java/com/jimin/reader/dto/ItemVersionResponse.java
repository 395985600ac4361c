package com.jimin.reader.dto;

import com.jimin.reader.entity.ItemVersion;

import java.time.Instant;

public record ItemVersionResponse(
        int version,
        String title,
        String content,
        String contentHash,
        Instant archivedAt
) {
    public static ItemVersionResponse from(ItemVersion version) {
        return new ItemVersionResponse(
                version.getVersion(),
                version.getTitle(),
                version.getContent(),
                version.getContentHash(),
                version.getArchivedAt()
        );
    }
}
