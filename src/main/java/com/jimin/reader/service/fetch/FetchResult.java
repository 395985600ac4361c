package com.jimin.reader.service.fetch;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * SourceFetcher 결과. 네트워크 오류를 포함한 모든 경우가 예외 대신 이 값으로 온다.
 *
 * @param statusCode 마지막 HTTP 상태 코드 (네트워크 오류면 null)
 * @param body       SUCCESS 일 때만 값이 있음
 * @param finalUrl   redirect 를 따라간 뒤 실제로 응답한 URL
 * @param retryAfter 429/503 의 Retry-After (없으면 null)
 */
public record FetchResult(
        FetchStatus status,
        Integer statusCode,
        byte[] body,
        String finalUrl,
        CacheHeaders cacheHeaders,
        List<RedirectHop> redirects,
        Duration retryAfter,
        String message
) {

    public static FetchResult success(int statusCode, byte[] body, String finalUrl,
                                      CacheHeaders cacheHeaders, List<RedirectHop> redirects) {
        return new FetchResult(FetchStatus.SUCCESS, statusCode, body, finalUrl,
                cacheHeaders, List.copyOf(redirects), null, null);
    }

    public static FetchResult notModified(String finalUrl, CacheHeaders cacheHeaders, List<RedirectHop> redirects) {
        return new FetchResult(FetchStatus.NOT_MODIFIED, 304, null, finalUrl,
                cacheHeaders, List.copyOf(redirects), null, null);
    }

    public static FetchResult rateLimited(Duration retryAfter) {
        String message = retryAfter != null
                ? "Rate limited (retry after " + retryAfter.toSeconds() + "s)"
                : "Rate limited";
        return new FetchResult(FetchStatus.RATE_LIMITED, 429, null, null,
                CacheHeaders.NONE, List.of(), retryAfter, message);
    }

    public static FetchResult clientError(int statusCode, String message) {
        return new FetchResult(FetchStatus.CLIENT_ERROR, statusCode, null, null,
                CacheHeaders.NONE, List.of(), null, message);
    }

    public static FetchResult serverError(int statusCode, Duration retryAfter, String message) {
        return new FetchResult(FetchStatus.SERVER_ERROR, statusCode, null, null,
                CacheHeaders.NONE, List.of(), retryAfter, message);
    }

    public static FetchResult networkError(String message) {
        return new FetchResult(FetchStatus.NETWORK_ERROR, null, null, null,
                CacheHeaders.NONE, List.of(), null, message);
    }

    public static FetchResult tooManyRedirects(String lastUrl, List<RedirectHop> redirects) {
        return new FetchResult(FetchStatus.TOO_MANY_REDIRECTS, null, null, lastUrl,
                CacheHeaders.NONE, List.copyOf(redirects), null, "Too many redirects (last: " + lastUrl + ")");
    }

    /**
     * 맨 앞에서부터 이어지는 영구 redirect(301/308)의 최종 대상
     *
     * 301 → 302 → 200 이면 첫 번째 301 대상만 영구 이동으로 본다.
     * 첫 hop 이 임시 redirect 면 없음.
     */
    public Optional<String> permanentRedirectTarget() {
        String target = null;
        for (RedirectHop hop : redirects) {
            if (!hop.permanent()) {
                break;
            }
            target = hop.url();
        }
        return Optional.ofNullable(target);
    }
}
