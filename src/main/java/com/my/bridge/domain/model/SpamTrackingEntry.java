package com.my.bridge.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 사용자별 슬라이딩 윈도우 카운터 상태를 표현하고, 만료 판단을 한 곳에서 하기 위함.
 */
public record SpamTrackingEntry(SpamKey key,
                                int messageCount,
                                Instant firstMessageTime,
                                Instant lastMessageTime,
                                boolean blocked) {

    public SpamTrackingEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(firstMessageTime, "firstMessageTime");
        Objects.requireNonNull(lastMessageTime, "lastMessageTime");
    }

    public static SpamTrackingEntry first(SpamKey key, Instant now) {
        return new SpamTrackingEntry(key, 1, now, now, false);
    }

    public boolean isLive(Instant now, Duration window) {
        return lastMessageTime.plus(window).isAfter(now);
    }

    public SpamTrackingEntry increment(Instant now, int threshold) {
        int next = messageCount + 1;
        return new SpamTrackingEntry(key, next, firstMessageTime, now, next >= threshold);
    }
}
