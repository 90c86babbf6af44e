package com.my.bridge.domain.port.in;

import com.my.bridge.domain.model.Actor;
import com.my.bridge.domain.model.CleanupResult;
import com.my.bridge.domain.model.PendingConfirmation;

import java.util.concurrent.CompletionStage;

/**
 * 왜: 보존 기간 정리를 스케줄러(확인 없음)와 관리자 명령(확인 필요) 두 경로에서 같은 규칙으로 실행하기 위함.
 */
public interface RetentionUseCase {

    int sweep(int days);

    Cleanup requestCleanup(Actor actor, int days);

    record Cleanup(PendingConfirmation confirmation, CompletionStage<CleanupResult> result) {
    }
}
