package com.my.bridge.domain.model;

import java.util.List;

public record ServerStats(long serverId,
                          int activeConnections,
                          int connectionLimit,
                          long messagesLastMonth,
                          List<ConnectionActivity> topConnections) {

    public ServerStats {
        topConnections = List.copyOf(topConnections);
    }

    public int freeSlots() {
        return Math.max(0, connectionLimit - activeConnections);
    }
}
