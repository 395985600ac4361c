package com.jimin.reader.service.fetch;

/**
 * fetch 응답 분류
 */
public enum FetchStatus {
    SUCCESS,
    NOT_MODIFIED,
    RATE_LIMITED,
    CLIENT_ERROR,
    SERVER_ERROR,
    NETWORK_ERROR,
    TOO_MANY_REDIRECTS;

    public boolean isSuccessful() {
        return this == SUCCESS || this == NOT_MODIFIED;
    }
}
