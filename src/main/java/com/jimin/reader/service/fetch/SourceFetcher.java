package com.jimin.reader.service.fetch;

import com.jimin.reader.config.FetchProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * 피드 HTTP fetch (조건부 GET + 수동 redirect 추적)
 *
 * DB 를 건드리지 않고 트랜잭션 밖에서 호출된다.
 * 네트워크 오류, 4xx/5xx 를 포함한 모든 결과는 예외가 아니라 FetchResult 로 돌려준다.
 */
@Component
@Slf4j
public class SourceFetcher {

    private static final String ACCEPT = "application/rss+xml, application/atom+xml, application/feed+json, "
            + "application/xml;q=0.9, text/xml;q=0.9, */*;q=0.8";

    private final RestTemplate restTemplate;
    private final OriginRateLimiter originRateLimiter;
    private final FetchProperties properties;
    private final Clock clock;

    public SourceFetcher(@Qualifier("feedRestTemplate") RestTemplate restTemplate,
                         OriginRateLimiter originRateLimiter,
                         FetchProperties properties,
                         Clock clock) {
        this.restTemplate = restTemplate;
        this.originRateLimiter = originRateLimiter;
        this.properties = properties;
        this.clock = clock;
    }

    public FetchResult fetch(FetchRequest request) {
        URI uri;
        try {
            uri = URI.create(request.url());
        } catch (IllegalArgumentException e) {
            return FetchResult.networkError("Invalid URL: " + request.url());
        }

        HttpEntity<Void> entity = new HttpEntity<>(buildHeaders(request));
        List<RedirectHop> redirects = new ArrayList<>();

        while (true) {
            ResponseEntity<byte[]> response;
            try {
                originRateLimiter.acquire(uri);
                response = restTemplate.exchange(uri, HttpMethod.GET, entity, byte[].class);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return FetchResult.networkError("Interrupted while waiting for " + uri.getHost());
            } catch (ResourceAccessException e) {
                log.debug("fetch 네트워크 오류: {} - {}", uri, e.getMessage());
                return FetchResult.networkError(describe(e));
            } catch (RestClientException e) {
                log.debug("fetch 실패: {} - {}", uri, e.getMessage());
                return FetchResult.networkError(e.getMessage());
            }

            int status = response.getStatusCode().value();
            HttpHeaders headers = response.getHeaders();

            if (isRedirect(status)) {
                String location = headers.getFirst(HttpHeaders.LOCATION);
                if (location == null || location.isBlank()) {
                    return FetchResult.clientError(status, "Redirect " + status + " without Location header");
                }
                URI next;
                try {
                    next = uri.resolve(location.trim());
                } catch (IllegalArgumentException e) {
                    return FetchResult.clientError(status, "Invalid redirect Location: " + location);
                }
                redirects.add(new RedirectHop(next.toString(), status, status == 301 || status == 308));
                if (redirects.size() > properties.getMaxRedirects()) {
                    return FetchResult.tooManyRedirects(next.toString(), redirects);
                }
                log.debug("redirect {} → {} ({})", uri, next, status);
                uri = next;
                continue;
            }

            String finalUrl = uri.toString();
            if (status == 304) {
                return FetchResult.notModified(finalUrl, CacheHeaders.from(headers), redirects);
            }
            if (status >= 200 && status < 300) {
                byte[] body = response.getBody() != null ? response.getBody() : new byte[0];
                return FetchResult.success(status, body, finalUrl, CacheHeaders.from(headers), redirects);
            }
            if (status == 429) {
                return FetchResult.rateLimited(parseRetryAfter(headers.getFirst(HttpHeaders.RETRY_AFTER)));
            }
            if (status >= 500) {
                return FetchResult.serverError(status,
                        parseRetryAfter(headers.getFirst(HttpHeaders.RETRY_AFTER)),
                        "HTTP " + status);
            }
            return FetchResult.clientError(status, "HTTP " + status);
        }
    }

    private HttpHeaders buildHeaders(FetchRequest request) {
        HttpHeaders headers = new HttpHeaders();
        String userAgent = properties.getUserAgent();
        if (request.sourceId() != null) {
            userAgent += " (source:" + request.sourceId() + ")";
        }
        headers.set(HttpHeaders.USER_AGENT, userAgent);
        headers.set(HttpHeaders.ACCEPT, ACCEPT);
        if (request.etag() != null) {
            headers.set(HttpHeaders.IF_NONE_MATCH, request.etag());
        }
        if (request.lastModified() != null) {
            headers.set(HttpHeaders.IF_MODIFIED_SINCE, request.lastModified());
        }
        return headers;
    }

    private static boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    /**
     * Retry-After: 초 단위 숫자 또는 HTTP-date. 해석할 수 없으면 null
     */
    Duration parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() <= 9 && trimmed.chars().allMatch(Character::isDigit)) {
            return Duration.ofSeconds(Long.parseLong(trimmed));
        }
        try {
            Instant at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            Duration wait = Duration.between(clock.instant(), at);
            return wait.isNegative() ? Duration.ZERO : wait;
        } catch (DateTimeParseException e) {
            log.debug("Retry-After 해석 실패: {}", value);
            return null;
        }
    }

    private static String describe(ResourceAccessException e) {
        Throwable cause = e.getCause();
        if (cause instanceof HttpTimeoutException || cause instanceof SocketTimeoutException) {
            return "Request timeout";
        }
        if (cause instanceof UnknownHostException) {
            return "Unknown host: " + cause.getMessage();
        }
        if (cause instanceof ConnectException) {
            return "Connection refused";
        }
        return cause != null && cause.getMessage() != null ? cause.getMessage() : e.getMessage();
    }
}
