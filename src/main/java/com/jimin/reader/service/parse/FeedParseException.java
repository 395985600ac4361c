package com.jimin.reader.service.parse;

/**
 * 응답 본문을 RSS/Atom/JSON Feed 로 해석할 수 없음 (fetch 실패로 취급되어 backoff)
 */
public class FeedParseException extends Exception {

    public FeedParseException(String message) {
        super(message);
    }

    public FeedParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
