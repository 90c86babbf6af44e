package com.my.bridge.domain.model;

public record DatabaseStats(long activeConnections, long totalMessages, long totalServers) {
}
