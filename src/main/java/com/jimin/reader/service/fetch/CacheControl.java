package com.jimin.reader.service.fetch;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Cache-Control 헤더 중 스케줄링에 쓰는 지시자만
 *
 * @param maxAge  max-age (초), 없으면 null
 * @param sMaxAge s-maxage (초), 없으면 null
 */
public record CacheControl(
        Long maxAge,
        Long sMaxAge,
        boolean noStore,
        boolean noCache
) {
    public static final CacheControl EMPTY = new CacheControl(null, null, false, false);

    /**
     * 예: "public, max-age=3600" → maxAge=3600
     * 모르는 지시자, 음수/숫자 아닌 값은 무시
     */
    public static CacheControl parse(String header) {
        if (header == null || header.isBlank()) {
            return EMPTY;
        }
        Long maxAge = null;
        Long sMaxAge = null;
        boolean noStore = false;
        boolean noCache = false;

        for (String raw : header.toLowerCase(Locale.ROOT).split(",")) {
            String directive = raw.trim();
            int eq = directive.indexOf('=');
            if (eq < 0) {
                if (directive.equals("no-store")) {
                    noStore = true;
                } else if (directive.equals("no-cache")) {
                    noCache = true;
                }
                continue;
            }
            String name = directive.substring(0, eq).trim();
            Long seconds = parseSeconds(directive.substring(eq + 1));
            if (name.equals("max-age")) {
                maxAge = seconds;
            } else if (name.equals("s-maxage")) {
                sMaxAge = seconds;
            }
        }
        return new CacheControl(maxAge, sMaxAge, noStore, noCache);
    }

    /**
     * 스케줄링에 쓸 유효 max-age. no-store 면 없음, s-maxage 우선
     */
    public Optional<Duration> effectiveMaxAge() {
        if (noStore) {
            return Optional.empty();
        }
        if (sMaxAge != null) {
            return Optional.of(Duration.ofSeconds(sMaxAge));
        }
        if (maxAge != null) {
            return Optional.of(Duration.ofSeconds(maxAge));
        }
        return Optional.empty();
    }

    private static Long parseSeconds(String value) {
        String unquoted = value.trim().replaceAll("^\"(.*)\"$", "$1");
        try {
            long seconds = Long.parseLong(unquoted);
            return seconds >= 0 ? seconds : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
