package com.jimin.reader.service.fetch;

import com.jimin.reader.entity.Item;
import com.jimin.reader.entity.Job;
import com.jimin.reader.entity.JobType;
import com.jimin.reader.entity.Source;
import com.jimin.reader.service.job.JobOutcome;
import com.jimin.reader.service.job.JobRunner;
import com.jimin.reader.service.subscription.SubscriptionService;
import com.jimin.reader.support.IntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * claim → fetch → 반영 → finish 전체 사이클 (HTTP 는 MockRestServiceServer)
 */
class FetchJobHandlerTest extends IntegrationTest {

    private static final String FEED = "https://news.example.com/rss";
    private static final String MOVED = "https://moved.example.com/rss";

    private static final String RSS = """
            <?xml version="1.0" encoding="UTF-8"?>
            <rss version="2.0">
              <channel>
                <title>Example News</title>
                <link>https://news.example.com</link>
                <description>news</description>
                <item>
                  <title>Hello</title>
                  <link>https://news.example.com/hello</link>
                  <guid>hello-1</guid>
                  <description>first body</description>
                </item>
              </channel>
            </rss>
            """;

    @Autowired
    private JobRunner jobRunner;

    @Autowired
    private SubscriptionService subscriptionService;

    @Autowired
    private FetchResultApplier resultApplier;

    @Autowired
    @Qualifier("feedRestTemplate")
    private RestTemplate feedRestTemplate;

    private MockRestServiceServer server;
    private Long sourceId;

    @BeforeEach
    void setUp() {
        server = MockRestServiceServer.bindTo(feedRestTemplate).build();
        sourceId = subscriptionService.subscribe(1L, FEED).sourceId();
    }

    @Test
    void successStoresItemsValidatorsAndSchedulesByCacheControl() {
        HttpHeaders headers = new HttpHeaders();
        headers.setETag("\"abc\"");
        headers.setCacheControl("max-age=7200");
        server.expect(requestTo(FEED)).andRespond(withSuccess(RSS, MediaType.APPLICATION_XML).headers(headers));

        assertThat(jobRunner.runOnce()).isTrue();

        server.verify();
        Source source = sourceRepository.findById(sourceId).orElseThrow();
        assertThat(source.getTitle()).isEqualTo("Example News");
        assertThat(source.getEtag()).isEqualTo("\"abc\"");
        assertThat(source.getLastFetchedAt()).isEqualTo(clock.instant());
        assertThat(source.getConsecutiveFailures()).isZero();

        Job job = fetchJob();
        assertThat(job.getRunningSince()).isNull();
        assertThat(job.getNextRunAt()).isEqualTo(clock.instant().plus(Duration.ofHours(2)));
        assertThat(source.getNextFetchAt()).isEqualTo(job.getNextRunAt());

        List<Item> items = itemRepository.findBySourceIdOrderByFirstSeenAtDesc(sourceId);
        assertThat(items).extracting(Item::getDedupeKey).containsExactly("hello-1");
        assertThat(userItemStateRepository.count()).isEqualTo(1);
    }

    @Test
    void notModifiedUsesStoredValidators() {
        HttpHeaders headers = new HttpHeaders();
        headers.setETag("\"abc\"");
        server.expect(requestTo(FEED)).andRespond(withSuccess(RSS, MediaType.APPLICATION_XML).headers(headers));
        server.expect(requestTo(FEED))
                .andExpect(header(HttpHeaders.IF_NONE_MATCH, "\"abc\""))
                .andRespond(withStatus(HttpStatus.NOT_MODIFIED));

        jobRunner.runOnce();
        clock.advance(Duration.ofHours(1));
        assertThat(jobRunner.runOnce()).isTrue();

        server.verify();
        Job job = fetchJob();
        assertThat(job.getConsecutiveFailures()).isZero();
        // 힌트 없음 → 기본 60분
        assertThat(job.getNextRunAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(60)));
        assertThat(sourceRepository.findById(sourceId).orElseThrow().getEtag()).isEqualTo("\"abc\"");
        assertThat(itemRepository.countBySourceId(sourceId)).isEqualTo(1);
    }

    @Test
    void serverErrorsBackOffExponentially() {
        server.expect(requestTo(FEED)).andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));
        server.expect(requestTo(FEED)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        jobRunner.runOnce();
        Job first = fetchJob();
        assertThat(first.getConsecutiveFailures()).isEqualTo(1);
        assertThat(first.getLastError()).isEqualTo("HTTP 500");
        assertThat(first.getNextRunAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(30)));

        clock.set(first.getNextRunAt());
        jobRunner.runOnce();
        Job second = fetchJob();
        assertThat(second.getConsecutiveFailures()).isEqualTo(2);
        assertThat(second.getNextRunAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(60)));

        Source source = sourceRepository.findById(sourceId).orElseThrow();
        assertThat(source.getConsecutiveFailures()).isEqualTo(2);
        assertThat(source.getLastError()).isEqualTo("HTTP 503");
    }

    @Test
    void rateLimitHonorsRetryAfter() {
        server.expect(requestTo(FEED))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).header(HttpHeaders.RETRY_AFTER, "900"));

        jobRunner.runOnce();

        Job job = fetchJob();
        assertThat(job.getConsecutiveFailures()).isEqualTo(1);
        assertThat(job.getNextRunAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(15)));
    }

    @Test
    void unparseableBodyIsFailure() {
        server.expect(requestTo(FEED)).andRespond(withSuccess("<html>maintenance</html>", MediaType.TEXT_HTML));

        jobRunner.runOnce();

        Job job = fetchJob();
        assertThat(job.getConsecutiveFailures()).isEqualTo(1);
        assertThat(job.getLastError()).startsWith("Parse error");
        assertThat(itemRepository.countBySourceId(sourceId)).isZero();
    }

    @Test
    void permanentRedirectAdoptedAfterThreeObservations() {
        for (int i = 0; i < 3; i++) {
            server.expect(requestTo(FEED))
                    .andRespond(withStatus(HttpStatus.MOVED_PERMANENTLY).location(URI.create(MOVED)));
            server.expect(requestTo(MOVED)).andRespond(withSuccess(RSS, MediaType.APPLICATION_XML));
        }
        server.expect(requestTo(MOVED)).andRespond(withSuccess(RSS, MediaType.APPLICATION_XML));

        for (int i = 0; i < 3; i++) {
            assertThat(jobRunner.runOnce()).isTrue();
            String url = sourceRepository.findById(sourceId).orElseThrow().getUrl();
            assertThat(url).isEqualTo(i < 2 ? FEED : MOVED);
            clock.set(fetchJob().getNextRunAt());
        }
        // 이후 요청은 새 URL 로 바로 간다
        jobRunner.runOnce();

        server.verify();
        assertThat(itemRepository.countBySourceId(sourceId)).isEqualTo(1);
    }

    @Test
    void temporaryRedirectIsNeverPersisted() {
        for (int i = 0; i < 3; i++) {
            server.expect(requestTo(FEED))
                    .andRespond(withStatus(HttpStatus.FOUND).location(URI.create(MOVED)));
            server.expect(requestTo(MOVED)).andRespond(withSuccess(RSS, MediaType.APPLICATION_XML));
        }

        for (int i = 0; i < 3; i++) {
            jobRunner.runOnce();
            clock.set(fetchJob().getNextRunAt());
        }

        Source source = sourceRepository.findById(sourceId).orElseThrow();
        assertThat(source.getUrl()).isEqualTo(FEED);
        assertThat(source.getRedirectCandidateUrl()).isNull();
    }

    @Test
    void brokenPayloadIsRecordedAsFailure() {
        Job job = fetchJob();
        job.setPayload("{not json");
        jobRepository.save(job);

        assertThat(jobRunner.runOnce()).isTrue();

        Job failed = fetchJob();
        assertThat(failed.getRunningSince()).isNull();
        assertThat(failed.getConsecutiveFailures()).isEqualTo(1);
        assertThat(failed.getLastError()).startsWith("JobPayloadException");
        assertThat(failed.getNextRunAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(30)));
    }

    @Test
    void disabledJobIsNotRun() {
        subscriptionService.unsubscribe(1L, sourceId);

        assertThat(jobRunner.runOnce()).isFalse();
        server.verify();
    }

    @Test
    void resultArrivingAfterUnsubscribeKeepsScheduleCleared() {
        // fetch 는 이미 나갔고, 결과가 반영되기 전에 마지막 구독자가 해지
        subscriptionService.unsubscribe(1L, sourceId);

        JobOutcome outcome = resultApplier.apply(sourceId, FetchResult.networkError("Request timeout"));

        assertThat(outcome.nextRunAt()).isNotNull();
        Source source = sourceRepository.findById(sourceId).orElseThrow();
        assertThat(source.getNextFetchAt()).isNull();
        assertThat(source.getLastError()).isEqualTo("Request timeout");
    }

    private Job fetchJob() {
        return jobRepository.findByTypeAndSourceId(JobType.FETCH_SOURCE, sourceId).orElseThrow();
    }
}
