package com.my.bridge.domain.port.out;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.function.Predicate;

/**
 * 왜: "외부 신호를 조건과 제한 시간을 두고 기다린다"는 동작을 범용 계약으로 분리해 확인 절차가 전송 방식에 묶이지 않도록 하기 위함.
 */
public interface SignalAwaitPort<T> {

    /**
     * 조건을 만족하는 신호가 오면 그 값으로, 제한 시간이 지나면 빈 값으로 완료된다.
     */
    CompletionStage<Optional<T>> await(String key, Duration timeout, Predicate<T> accept);

    /**
     * 대기 중인 키가 없거나 조건을 통과하지 못하면 false.
     */
    boolean signal(String key, T value);
}
