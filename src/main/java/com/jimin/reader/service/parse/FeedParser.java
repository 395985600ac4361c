package com.jimin.reader.service.parse;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rometools.rome.feed.WireFeed;
import com.rometools.rome.feed.module.Module;
import com.rometools.rome.feed.module.SyModule;
import com.rometools.rome.feed.rss.Channel;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;

/**
 * RSS / Atom / JSON Feed 파싱
 *
 * Why: Rome 이 RSS 0.9x~2.0, RSS 1.0(RDF), Atom 을 모두 SyndFeed 하나로 맞춰준다.
 * 갱신 주기 힌트(<ttl>)는 RSS 원본(WireFeed)에만 있어서 preserveWireFeed 를 켠다.
 * 본문이 '{' 로 시작하면 JSON Feed 로 보고 JsonFeedParser 에 넘긴다.
 */
@Component
@Slf4j
public class FeedParser {

    private final JsonFeedParser jsonFeedParser;

    public FeedParser(ObjectMapper objectMapper) {
        this.jsonFeedParser = new JsonFeedParser(objectMapper);
    }

    public ParsedFeed parse(byte[] body) throws FeedParseException {
        if (JsonFeedParser.looksLikeJson(body)) {
            return jsonFeedParser.parse(body);
        }

        SyndFeed feed;
        try {
            SyndFeedInput input = new SyndFeedInput();
            input.setPreserveWireFeed(true);
            feed = input.build(new XmlReader(new ByteArrayInputStream(body)));
        } catch (FeedException | IOException | IllegalArgumentException e) {
            throw new FeedParseException("피드 파싱 실패: " + e.getMessage(), e);
        }

        List<ParsedItem> items = new ArrayList<>();
        for (SyndEntry entry : feed.getEntries()) {
            items.add(toParsedItem(entry));
        }

        return new ParsedFeed(
                trimToNull(feed.getTitle()),
                trimToNull(feed.getDescription()),
                trimToNull(feed.getLink()),
                items,
                hintInterval(feed)
        );
    }

    private ParsedItem toParsedItem(SyndEntry entry) {
        String summary = entry.getDescription() != null ? entry.getDescription().getValue() : null;
        String content = null;
        for (SyndContent syndContent : entry.getContents()) {
            if (syndContent.getValue() != null && !syndContent.getValue().isBlank()) {
                content = syndContent.getValue();
                break;
            }
        }
        Date published = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();

        return new ParsedItem(
                trimToNull(entry.getUri()),
                trimToNull(entry.getLink()),
                trimToNull(entry.getTitle()),
                trimToNull(entry.getAuthor()),
                content,
                summary,
                published != null ? published.toInstant() : null
        );
    }

    /**
     * RSS <ttl>(분) 우선, 없으면 sy:updatePeriod / sy:updateFrequency
     */
    Duration hintInterval(SyndFeed feed) {
        WireFeed wireFeed = feed.originalWireFeed();
        if (wireFeed instanceof Channel channel) {
            Integer ttl = channel.getTtl();
            if (ttl != null && ttl > 0) {
                return Duration.ofMinutes(ttl);
            }
        }

        Module module = feed.getModule(SyModule.URI);
        if (module == null && wireFeed != null) {
            module = wireFeed.getModule(SyModule.URI);
        }
        if (module instanceof SyModule sy) {
            return syndicationInterval(sy.getUpdatePeriod(), sy.getUpdateFrequency());
        }
        return null;
    }

    /**
     * updatePeriod 를 updateFrequency 번 갱신 → 주기 = period / frequency
     * frequency 가 없거나 0 이면 1 로 본다
     */
    static Duration syndicationInterval(String updatePeriod, Integer updateFrequency) {
        if (updatePeriod == null) {
            return null;
        }
        Duration period = switch (updatePeriod.trim().toLowerCase(Locale.ROOT)) {
            case SyModule.HOURLY -> Duration.ofHours(1);
            case SyModule.DAILY -> Duration.ofDays(1);
            case SyModule.WEEKLY -> Duration.ofDays(7);
            case SyModule.MONTHLY -> Duration.ofDays(30);
            case SyModule.YEARLY -> Duration.ofDays(365);
            default -> null;
        };
        if (period == null) {
            log.debug("알 수 없는 sy:updatePeriod: {}", updatePeriod);
            return null;
        }
        int frequency = updateFrequency != null && updateFrequency > 0 ? updateFrequency : 1;
        return period.dividedBy(frequency);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
