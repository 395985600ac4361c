package com.jimin.reader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * ReaderApplication - 피드 동기화 코어
 *
 * - DB 기반 Job 큐 (claim / finish, stale 재claim)
 * - 조건부 GET + redirect 추적 + 적응형 스케줄링
 * - Item reconcile (버전 이력 보관)
 * - 사용자별 읽음/별표 상태 병합
 * - 구독 수에 따른 fetch Job 활성/비활성
 */
@SpringBootApplication
@EnableScheduling  // Why: FetchWorker 의 @Scheduled 폴링 활성화
@ConfigurationPropertiesScan
public class ReaderApplication {

	public static void main(String[] args) {
		SpringApplication.run(ReaderApplication.class, args);
	}

}
