package com.my.bridge.domain.model;

/**
 * 왜: 확인 절차를 대기 상태 하나와 종결 상태 셋으로 명시해 만료와 거절을 구분하기 위함.
 */
public enum ConfirmationState {
    AWAITING_CONFIRMATION,
    CONFIRMED,
    DECLINED,
    EXPIRED;

    public boolean isTerminal() {
        return this != AWAITING_CONFIRMATION;
    }
}
