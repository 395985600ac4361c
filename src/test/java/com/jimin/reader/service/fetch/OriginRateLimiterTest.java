package com.jimin.reader.service.fetch;

import com.jimin.reader.config.FetchProperties;
import com.jimin.reader.entity.OriginRateLimit;
import com.jimin.reader.support.IntegrationTest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.net.URI;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class OriginRateLimiterTest extends IntegrationTest {

    private static final String ORIGIN = "https://feeds.example.com:443";

    @Autowired
    private OriginRateLimiter rateLimiter;

    @Autowired
    private FetchProperties properties;

    private Duration originalInterval;

    @BeforeEach
    void setUp() {
        originalInterval = properties.getOriginInterval();
        properties.setOriginInterval(Duration.ofSeconds(1));
    }

    @AfterEach
    void restore() {
        properties.setOriginInterval(originalInterval);
    }

    @Test
    void reservesConsecutiveSlotsPerOrigin() {
        assertThat(rateLimiter.reserve(ORIGIN)).isEqualTo(Duration.ZERO);
        assertThat(rateLimiter.reserve(ORIGIN)).isEqualTo(Duration.ofSeconds(1));
        assertThat(rateLimiter.reserve(ORIGIN)).isEqualTo(Duration.ofSeconds(2));

        OriginRateLimit limit = originRateLimitRepository.findById(ORIGIN).orElseThrow();
        assertThat(limit.getNextSlotAt()).isEqualTo(clock.instant().plusSeconds(3));
    }

    @Test
    void originsAreIndependent() {
        rateLimiter.reserve(ORIGIN);

        assertThat(rateLimiter.reserve("https://other.example.com:443")).isEqualTo(Duration.ZERO);
    }

    @Test
    void slotFreesUpAsTimePasses() {
        rateLimiter.reserve(ORIGIN);
        rateLimiter.reserve(ORIGIN);

        clock.advance(Duration.ofSeconds(5));

        assertThat(rateLimiter.reserve(ORIGIN)).isEqualTo(Duration.ZERO);
    }

    @Test
    void disabledWhenIntervalIsZero() {
        properties.setOriginInterval(Duration.ZERO);

        assertThat(rateLimiter.reserve(ORIGIN)).isEqualTo(Duration.ZERO);
        assertThat(rateLimiter.reserve(ORIGIN)).isEqualTo(Duration.ZERO);
        assertThat(originRateLimitRepository.count()).isZero();
    }

    @Test
    void originIncludesSchemeHostAndDefaultPort() {
        assertThat(OriginRateLimiter.originOf(URI.create("https://Feeds.Example.com/a/rss?x=1")))
                .isEqualTo(ORIGIN);
        assertThat(OriginRateLimiter.originOf(URI.create("http://feeds.example.com:8080/rss")))
                .isEqualTo("http://feeds.example.com:8080");
        assertThat(OriginRateLimiter.originOf(URI.create("http://feeds.example.com/rss")))
                .isEqualTo("http://feeds.example.com:80");
    }
}
