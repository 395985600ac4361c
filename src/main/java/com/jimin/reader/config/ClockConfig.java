package com.jimin.reader.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Why: 시간 의존 로직(claim, backoff, 상태 병합)을 테스트에서 고정 시각으로 돌리기 위해 Clock 을 주입
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
