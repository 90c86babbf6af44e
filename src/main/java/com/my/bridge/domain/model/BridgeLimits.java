package com.my.bridge.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * 왜: 전역 설정 객체 대신 시작 시 한 번 만든 한도 값을 서비스마다 명시적으로 넘기기 위함.
 */
public record BridgeLimits(String commandPrefix,
                           int spamThreshold,
                           Duration spamWindow,
                           int maxConnectionsPerServer,
                           long maxFileSize,
                           int maxAttachments,
                           int maxMessageLength,
                           int minRetentionDays,
                           Duration confirmationTimeout) {

    public BridgeLimits {
        Objects.requireNonNull(commandPrefix, "commandPrefix");
        Objects.requireNonNull(spamWindow, "spamWindow");
        Objects.requireNonNull(confirmationTimeout, "confirmationTimeout");
        if (spamThreshold < 1 || maxConnectionsPerServer < 1 || maxAttachments < 0 || maxMessageLength < 4) {
            throw new IllegalArgumentException("한도 값이 올바르지 않습니다.");
        }
    }
}
