package com.jimin.reader.service.reconcile;

import com.jimin.reader.service.parse.ParsedItem;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Item 식별 키 / 내용 fingerprint
 */
final class ItemFingerprint {

    // items.dedupe_key 컬럼 길이
    static final int MAX_KEY_LENGTH = 1000;

    private static final String HASHED_KEY_PREFIX = "sha256:";

    private ItemFingerprint() {
    }

    /**
     * 중복 판단 키: externalId → link → title 순서. 셋 다 없으면 null (저장하지 않음)
     *
     * title fallback 은 제목이 같은 다른 글을 하나로 합칠 수 있다. 감수한다.
     * 컬럼보다 긴 키는 "sha256:" + 해시로 바꿔 저장한다 (같은 원본 키 → 항상 같은 값).
     */
    static String dedupeKey(ParsedItem item) {
        String key = rawKey(item);
        if (key == null || key.length() <= MAX_KEY_LENGTH) {
            return key;
        }
        return HASHED_KEY_PREFIX + sha256(key);
    }

    private static String rawKey(ParsedItem item) {
        if (hasText(item.externalId())) {
            return item.externalId().trim();
        }
        if (hasText(item.link())) {
            return item.link().trim();
        }
        if (hasText(item.title())) {
            return item.title().trim();
        }
        return null;
    }

    /**
     * SHA-256(title + "\n" + content), content 가 없으면 summary
     */
    static String contentHash(ParsedItem item) {
        String body = item.content() != null ? item.content() : item.summary();
        return sha256(nullToEmpty(item.title()) + "\n" + nullToEmpty(body));
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // 모든 JVM 이 SHA-256 을 제공해야 함
            throw new IllegalStateException(e);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
