package com.jimin.reader.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;

/**
 * EventBus 기본 구현 - Spring ApplicationEvent 로 발행
 *
 * 실제 전달 계층(Redis, SSE 등)은 BusEvent 를 @EventListener 로 받아 내보낸다.
 * 리스너에서 난 예외는 로그만 남기고 삼킨다 (발행 실패가 fetch/reconcile 을 실패시키면 안 됨).
 *
 * Why: 트랜잭션 중에 바로 보내면 롤백된 Item 에 대한 item.created 가 나갈 수 있음
 *      → 진행 중인 트랜잭션이 있으면 afterCommit 에서 보낸다
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringEventBus implements EventBus {

    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    @Override
    public void publish(String topic, Object payload) {
        BusEvent event = new BusEvent(topic, payload, clock.instant());
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            deliver(event);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                deliver(event);
            }
        });
    }

    private void deliver(BusEvent event) {
        try {
            publisher.publishEvent(event);
            log.debug("이벤트 발행: {} {}", event.topic(), event.payload());
        } catch (RuntimeException e) {
            log.warn("이벤트 발행 실패 (무시): {} {} - {}", event.topic(), event.payload(), e.getMessage(), e);
        }
    }
}
