package com.my.bridge.domain.service;

import com.my.bridge.domain.exception.ValidationError;
import com.my.bridge.domain.exception.ValidationException;
import com.my.bridge.domain.model.Actor;
import com.my.bridge.domain.model.CleanupResult;
import com.my.bridge.domain.model.ConfirmationState;
import com.my.bridge.domain.model.PendingConfirmation;
import com.my.bridge.domain.port.in.RetentionUseCase;
import com.my.bridge.domain.port.out.ClockPort;
import com.my.bridge.domain.port.out.SpamTrackingRepository;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletionStage;

/**
 * 왜: 보존 기간이 지난 스팸 추적 행만 지우는 정리 규칙을 최소 기간 검증과 함께 한 곳에 두기 위함.
 * 연결 행과 메시지 기록은 건드리지 않는다.
 */
public class RetentionService implements RetentionUseCase {

    private static final Logger log = Logger.getLogger(RetentionService.class);

    private final SpamTrackingRepository spamTracking;
    private final ConfirmationService confirmations;
    private final ClockPort clockPort;
    private final int minRetentionDays;

    public RetentionService(SpamTrackingRepository spamTracking,
                            ConfirmationService confirmations,
                            ClockPort clockPort,
                            int minRetentionDays) {
        this.spamTracking = spamTracking;
        this.confirmations = confirmations;
        this.clockPort = clockPort;
        this.minRetentionDays = minRetentionDays;
    }

    @Override
    public int sweep(int days) {
        validate(days);
        Instant cutoff = clockPort.now().minus(Duration.ofDays(days));
        int deleted = spamTracking.deleteLastSeenBefore(cutoff);
        log.infof("보존 기간 정리 완료: %d일 이전 스팸 추적 %d건 삭제", days, deleted);
        return deleted;
    }

    @Override
    public Cleanup requestCleanup(Actor actor, int days) {
        validate(days);
        PendingConfirmation pending = confirmations.begin(actor.userId(), "cleanup:" + days);
        CompletionStage<CleanupResult> result = pending.outcome().thenApply(state -> state == ConfirmationState.CONFIRMED
                ? new CleanupResult(days, state, sweep(days))
                : new CleanupResult(days, state, 0));
        return new Cleanup(pending, result);
    }

    private void validate(int days) {
        if (days < minRetentionDays) {
            throw new ValidationException(ValidationError.RETENTION_TOO_SHORT,
                    "정리 기간은 최소 " + minRetentionDays + "일이어야 합니다.");
        }
    }
}
