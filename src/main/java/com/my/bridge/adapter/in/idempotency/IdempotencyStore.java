package com.my.bridge.adapter.in.idempotency;

/**
 * 왜: 브로커가 같은 게이트웨이 이벤트를 다시 전달해도 중계가 두 번 일어나지 않도록 이벤트 ID를 기억하기 위함.
 * 기록은 TTL이 지나면 잊힌다.
 */
public interface IdempotencyStore {

    boolean isProcessed(String eventId);

    void markProcessed(String eventId);
}
