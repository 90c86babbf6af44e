package com.my.bridge.domain.model;

/**
 * 왜: 게이트웨이가 넘겨주는 메시지 유형 코드 중 사용자가 직접 쓴 메시지만 중계 대상으로 구분하기 위함.
 */
public enum MessageKind {
    DEFAULT,
    REPLY,
    EDIT,
    SYSTEM;

    // 플랫폼 코드: 0 = 일반, 19 = 답장. 나머지는 전부 시스템 메시지로 본다.
    public static MessageKind fromCode(int code) {
        return switch (code) {
            case 0 -> DEFAULT;
            case 19 -> REPLY;
            default -> SYSTEM;
        };
    }

    public boolean isRelayable() {
        return this == DEFAULT || this == REPLY;
    }
}
