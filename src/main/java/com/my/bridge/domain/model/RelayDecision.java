package com.my.bridge.domain.model;

/**
 * 왜: 중계 파이프라인이 어느 단계에서 멈췄는지 로그와 테스트에서 구분하기 위함.
 */
public enum RelayDecision {
    IGNORED_AUTOMATED,
    IGNORED_KIND,
    IGNORED_COMMAND,
    DISABLED,
    SPAM_BLOCKED,
    NO_CONNECTIONS,
    FILTERED,
    RELAYED
}
