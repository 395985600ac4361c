package com.jimin.reader.service.fetch;

/**
 * 조건부 GET 요청 (etag / lastModified 는 이전 응답에서 받은 값, 없으면 null)
 */
public record FetchRequest(
        Long sourceId,
        String url,
        String etag,
        String lastModified
) {
}
