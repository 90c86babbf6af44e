package com.my.bridge.domain.model;

import java.util.Objects;
import java.util.concurrent.CompletionStage;

/**
 * 왜: 사용자 응답을 기다리는 확인 절차의 식별자와 최종 결과(비동기)를 함께 전달하기 위함.
 */
public record PendingConfirmation(String id, long requesterId, String subject, CompletionStage<ConfirmationState> outcome) {

    public PendingConfirmation {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(outcome, "outcome");
    }
}
