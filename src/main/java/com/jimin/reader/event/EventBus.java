package com.jimin.reader.event;

/**
 * 외부 전달 계층(SSE, push 등)에 알리는 pub/sub 통로
 *
 * fire-and-forget, at-most-once. publish 실패가 호출자에게 전파되면 안 된다.
 * 트랜잭션 안에서 호출되면 커밋된 뒤에만 전달된다 (롤백되면 버려짐).
 */
public interface EventBus {

    String ITEM_CREATED = "item.created";
    String ITEM_UPDATED = "item.updated";
    String ITEM_STATE_CHANGED = "item.state_changed";
    String SUBSCRIPTION_CREATED = "subscription.created";
    String SUBSCRIPTION_REMOVED = "subscription.removed";

    void publish(String topic, Object payload);
}
