package com.my.bridge.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 전달된 메시지 한 건의 출처를 감사/중복 방지용으로 남기기 위함. 한 번 기록되면 바뀌지 않는다.
 */
public record MessageLogEntry(long originalMessageId,
                              long forwardedMessageId,
                              long authorId,
                              long connectionId,
                              Instant timestamp,
                              String contentHash) {

    public MessageLogEntry {
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
