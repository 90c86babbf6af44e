package com.my.bridge.domain.model;

public record MessageStats(long totalMessages, long uniqueUsers, long activeConnections) {

    public static MessageStats empty() {
        return new MessageStats(0, 0, 0);
    }
}
