package com.jimin.reader.service.fetch;

import com.jimin.reader.config.FetchProperties;
import com.jimin.reader.entity.OriginRateLimit;
import com.jimin.reader.repository.OriginRateLimitRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * origin(scheme://host:port) 별 요청 간격 제한 (기본 1 req/s)
 *
 * 소스별 스케줄과 별개로, 같은 호스트에 소스가 많을 때 몰아서 요청하지 않도록 한다.
 * 슬롯 상태는 origin_rate_limits 테이블에 있어서 모든 워커 프로세스가 같은 제한을 본다.
 *
 * 동작: row lock → 다음 슬롯 예약 → 커밋 → (트랜잭션 밖에서) 슬롯 시각까지 대기
 */
@Component
@Slf4j
public class OriginRateLimiter {

    private final OriginRateLimitRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final FetchProperties properties;
    private final Clock clock;

    public OriginRateLimiter(OriginRateLimitRepository repository,
                             PlatformTransactionManager transactionManager,
                             FetchProperties properties,
                             Clock clock) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 이 origin 에 요청해도 되는 시각까지 대기
     */
    public void acquire(URI uri) throws InterruptedException {
        String origin = originOf(uri);
        Duration wait = reserve(origin);
        if (wait.compareTo(Duration.ZERO) > 0) {
            log.debug("origin 요청 간격 대기: {} {}ms", origin, wait.toMillis());
            Thread.sleep(wait.toMillis());
        }
    }

    /**
     * 다음 슬롯을 예약하고, 그 슬롯까지 남은 시간을 돌려준다 (대기는 하지 않음)
     */
    public Duration reserve(String origin) {
        Duration interval = properties.getOriginInterval();
        if (interval.compareTo(Duration.ZERO) <= 0) {
            return Duration.ZERO;
        }
        try {
            return transactionTemplate.execute(status -> reserveSlot(origin, interval));
        } catch (DataIntegrityViolationException e) {
            // 다른 워커가 같은 origin 의 첫 row 를 먼저 insert → 이제 row 가 있으니 lock 경로로 재시도
            log.debug("origin row 동시 생성, 재시도: {}", origin);
            return transactionTemplate.execute(status -> reserveSlot(origin, interval));
        }
    }

    private Duration reserveSlot(String origin, Duration interval) {
        Instant now = clock.instant();
        OriginRateLimit limit = repository.findByOriginForUpdate(origin).orElse(null);
        if (limit == null) {
            repository.saveAndFlush(new OriginRateLimit(origin, now.plus(interval)));
            return Duration.ZERO;
        }
        Instant slot = limit.getNextSlotAt().isAfter(now) ? limit.getNextSlotAt() : now;
        limit.setNextSlotAt(slot.plus(interval));
        return Duration.between(now, slot);
    }

    static String originOf(URI uri) {
        String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : "http";
        String host = uri.getHost() != null ? uri.getHost().toLowerCase(Locale.ROOT) : "";
        int port = uri.getPort();
        if (port < 0) {
            port = scheme.equals("https") ? 443 : 80;
        }
        return scheme + "://" + host + ":" + port;
    }
}
