package com.my.bridge.adapter.out.signal;

import com.my.bridge.domain.port.out.SignalAwaitPort;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * 왜: 단일 프로세스 안에서 키별 대기자를 두고, 신호 또는 제한 시간 중 먼저 오는 쪽으로 완료시키기 위함.
 * 후속 작업은 타이머 스레드가 아니라 주어진 executor에서 돈다.
 */
public class InMemorySignalAwaiter<T> implements SignalAwaitPort<T> {

    private final Map<String, Waiter<T>> waiters = new ConcurrentHashMap<>();
    private final Executor executor;

    public InMemorySignalAwaiter() {
        this(ForkJoinPool.commonPool());
    }

    public InMemorySignalAwaiter(Executor executor) {
        this.executor = executor;
    }

    @Override
    public CompletionStage<Optional<T>> await(String key, Duration timeout, Predicate<T> accept) {
        CompletableFuture<Optional<T>> future = new CompletableFuture<>();
        Waiter<T> waiter = new Waiter<>(future, accept);
        if (waiters.putIfAbsent(key, waiter) != null) {
            throw new IllegalStateException("이미 대기 중인 키입니다: " + key);
        }
        future.completeOnTimeout(Optional.empty(), timeout.toMillis(), TimeUnit.MILLISECONDS);
        return future.whenCompleteAsync((value, error) -> waiters.remove(key, waiter), executor);
    }

    @Override
    public boolean signal(String key, T value) {
        Waiter<T> waiter = waiters.get(key);
        if (waiter == null || !waiter.accept().test(value)) {
            return false;
        }
        return waiter.future().complete(Optional.of(value));
    }

    int pending() {
        return waiters.size();
    }

    private record Waiter<T>(CompletableFuture<Optional<T>> future, Predicate<T> accept) {
    }
}
