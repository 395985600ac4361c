package com.jimin.reader.service.fetch;

/**
 * 따라간 redirect 1단계
 *
 * @param permanent 301/308 이면 true, 302/303/307 이면 false
 */
public record RedirectHop(
        String url,
        int statusCode,
        boolean permanent
) {
}
