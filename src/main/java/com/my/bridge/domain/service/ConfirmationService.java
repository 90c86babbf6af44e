package com.my.bridge.domain.service;

import com.my.bridge.domain.exception.NotFoundException;
import com.my.bridge.domain.model.ConfirmationSignal;
import com.my.bridge.domain.model.ConfirmationState;
import com.my.bridge.domain.model.PendingConfirmation;
import com.my.bridge.domain.port.in.ConfirmationUseCase;
import com.my.bridge.domain.port.out.SignalAwaitPort;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletionStage;

/**
 * 왜: 위험한 관리 작업(연결 삭제, 데이터 정리)을 요청자 본인의 승인/거절/시간 초과 중 하나로 끝나는
 * 두 단계 절차로 만들기 위함. 대기는 비동기라 호출 스레드를 붙잡지 않는다.
 */
public class ConfirmationService implements ConfirmationUseCase {

    private static final Logger log = Logger.getLogger(ConfirmationService.class);

    private final SignalAwaitPort<ConfirmationSignal> signals;
    private final Duration timeout;

    public ConfirmationService(SignalAwaitPort<ConfirmationSignal> signals, Duration timeout) {
        this.signals = signals;
        this.timeout = timeout;
    }

    public PendingConfirmation begin(long requesterId, String subject) {
        String id = UUID.randomUUID().toString();
        CompletionStage<ConfirmationState> outcome = signals
                .await(id, timeout, signal -> signal.userId() == requesterId)
                .thenApply(signal -> signal
                        .map(value -> value.approved() ? ConfirmationState.CONFIRMED : ConfirmationState.DECLINED)
                        .orElse(ConfirmationState.EXPIRED));
        outcome.thenAccept(state -> log.infof("확인 절차 종료: id=%s subject=%s state=%s", id, subject, state));
        return new PendingConfirmation(id, requesterId, subject, outcome);
    }

    @Override
    public void respond(String confirmationId, long userId, boolean approved) {
        if (!signals.signal(confirmationId, new ConfirmationSignal(userId, approved))) {
            throw new NotFoundException("대기 중인 확인 요청이 없거나 요청자가 아닙니다: " + confirmationId);
        }
    }

    public Duration timeout() {
        return timeout;
    }
}
