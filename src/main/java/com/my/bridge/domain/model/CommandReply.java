package com.my.bridge.domain.model;

import java.util.Map;
import java.util.Objects;

/**
 * 왜: 명령 처리 결과를 표현 계층이 그릴 수 있는 구조화된 형태로 고정하기 위함.
 */
public record CommandReply(String requestId,
                           long channelId,
                           ReplyStatus status,
                           String code,
                           String message,
                           Map<String, Object> data) {

    public CommandReply {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(status, "status");
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public enum ReplyStatus {
        OK,
        AWAITING_CONFIRMATION,
        CANCELLED,
        EXPIRED,
        ERROR
    }
}
