package com.jimin.reader.service.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON Feed (https://jsonfeed.org/version/1.1) 파싱
 *
 * 1.0 의 author(단수)도 받는다. JSON Feed 에는 갱신 주기 힌트가 없다.
 */
@RequiredArgsConstructor
@Slf4j
class JsonFeedParser {

    private static final String VERSION_PREFIX = "https://jsonfeed.org/version/";

    private final ObjectMapper objectMapper;

    /**
     * 본문 첫 글자(BOM, 공백 제외)가 '{' 이면 JSON 으로 본다
     */
    static boolean looksLikeJson(byte[] body) {
        int i = 0;
        if (body.length >= 3 && (body[0] & 0xFF) == 0xEF && (body[1] & 0xFF) == 0xBB && (body[2] & 0xFF) == 0xBF) {
            i = 3;
        }
        while (i < body.length && Character.isWhitespace(body[i])) {
            i++;
        }
        return i < body.length && body[i] == '{';
    }

    ParsedFeed parse(byte[] body) throws FeedParseException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new FeedParseException("JSON Feed 파싱 실패: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new FeedParseException("JSON Feed 파싱 실패: root 가 객체가 아님");
        }
        String version = text(root, "version");
        if (version == null || !version.startsWith(VERSION_PREFIX)) {
            throw new FeedParseException("JSON Feed 파싱 실패: version 없음 또는 잘못됨 (" + version + ")");
        }
        JsonNode itemsNode = root.get("items");
        if (itemsNode == null || !itemsNode.isArray()) {
            throw new FeedParseException("JSON Feed 파싱 실패: items 배열 없음");
        }

        List<ParsedItem> items = new ArrayList<>();
        for (JsonNode item : itemsNode) {
            items.add(toParsedItem(item));
        }
        return new ParsedFeed(
                text(root, "title"),
                text(root, "description"),
                text(root, "home_page_url"),
                items,
                null
        );
    }

    private ParsedItem toParsedItem(JsonNode item) {
        String contentText = text(item, "content_text");
        String content = firstNonNull(text(item, "content_html"), contentText);
        String summary = firstNonNull(text(item, "summary"), contentText);
        Instant published = firstNonNull(date(item, "date_published"), date(item, "date_modified"));

        return new ParsedItem(
                text(item, "id"),
                firstNonNull(text(item, "url"), text(item, "external_url")),
                text(item, "title"),
                author(item),
                content,
                summary,
                published
        );
    }

    // 1.1 authors[0].name, 없으면 1.0 author.name
    private static String author(JsonNode item) {
        JsonNode authors = item.get("authors");
        if (authors != null && authors.isArray() && !authors.isEmpty()) {
            String name = text(authors.get(0), "name");
            if (name != null) {
                return name;
            }
        }
        JsonNode author = item.get("author");
        return author != null ? text(author, "name") : null;
    }

    private static Instant date(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null) {
            return null;
        }
        try {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.parse(value, Instant::from);
        } catch (DateTimeParseException e) {
            log.debug("JSON Feed 날짜 형식 오류, 무시: {}={}", field, value);
            return null;
        }
    }

    // 문자열/숫자 값만 (1.0 은 id 를 숫자로 주기도 함), 공백이면 null
    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isValueNode() || value.isNull()) {
            return null;
        }
        String trimmed = value.asText().trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static <T> T firstNonNull(T first, T second) {
        return first != null ? first : second;
    }
}
