package com.jimin.reader.service.fetch;

import org.springframework.http.HttpHeaders;

/**
 * 응답의 캐시 관련 헤더 (ETag, Last-Modified 는 원문 그대로 보관해서 다음 요청에 돌려보낸다)
 */
public record CacheHeaders(
        String etag,
        String lastModified,
        CacheControl cacheControl
) {
    public static final CacheHeaders NONE = new CacheHeaders(null, null, CacheControl.EMPTY);

    public static CacheHeaders from(HttpHeaders headers) {
        return new CacheHeaders(
                headers.getFirst(HttpHeaders.ETAG),
                headers.getFirst(HttpHeaders.LAST_MODIFIED),
                CacheControl.parse(headers.getFirst(HttpHeaders.CACHE_CONTROL))
        );
    }
}
