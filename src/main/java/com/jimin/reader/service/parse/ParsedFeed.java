package com.jimin.reader.service.parse;

import java.time.Duration;
import java.util.List;

/**
 * @param hintInterval 피드가 스스로 알려준 갱신 주기 (RSS ttl, sy:updatePeriod). 없으면 null
 */
public record ParsedFeed(
        String title,
        String description,
        String siteUrl,
        List<ParsedItem> items,
        Duration hintInterval
) {
}
