package com.my.bridge.domain.service;

import com.my.bridge.domain.model.BotStats;
import com.my.bridge.domain.model.Connection;
import com.my.bridge.domain.model.ConnectionActivity;
import com.my.bridge.domain.model.DatabaseStats;
import com.my.bridge.domain.model.ServerStats;
import com.my.bridge.domain.port.in.StatsUseCase;
import com.my.bridge.domain.port.out.ClockPort;
import com.my.bridge.domain.port.out.ConnectionRepository;
import com.my.bridge.domain.port.out.MessageLogRepository;
import com.my.bridge.domain.port.out.RuntimeMetricsPort;
import com.my.bridge.domain.port.out.ServerSettingsRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * 왜: 관리자 통계를 읽기 전용 집계로만 만들어, 중계 경로와 저장소 쓰기에 영향을 주지 않기 위함.
 */
public class StatsService implements StatsUseCase {

    private static final int TOP_CONNECTIONS = 3;

    private final ConnectionRepository connections;
    private final MessageLogRepository messageLog;
    private final ServerSettingsRepository settings;
    private final RuntimeMetricsPort runtimeMetrics;
    private final ClockPort clockPort;
    private final int maxConnectionsPerServer;

    public StatsService(ConnectionRepository connections,
                        MessageLogRepository messageLog,
                        ServerSettingsRepository settings,
                        RuntimeMetricsPort runtimeMetrics,
                        ClockPort clockPort,
                        int maxConnectionsPerServer) {
        this.connections = connections;
        this.messageLog = messageLog;
        this.settings = settings;
        this.runtimeMetrics = runtimeMetrics;
        this.clockPort = clockPort;
        this.maxConnectionsPerServer = maxConnectionsPerServer;
    }

    @Override
    public BotStats botStats() {
        DatabaseStats database = new DatabaseStats(connections.countActive(), messageLog.countAll(), settings.count());
        Instant weekAgo = clockPort.now().minus(Duration.ofDays(7));
        return new BotStats(database, messageLog.statsSince(weekAgo), runtimeMetrics.snapshot());
    }

    @Override
    public ServerStats serverStats(long serverId) {
        List<Connection> active = connections.listActiveByServer(serverId);
        Instant now = clockPort.now();
        Instant monthAgo = now.minus(Duration.ofDays(30));
        Instant weekAgo = now.minus(Duration.ofDays(7));
        long monthly = active.stream()
                .mapToLong(connection -> messageLog.statsForConnectionSince(connection.id(), monthAgo).totalMessages())
                .sum();
        List<ConnectionActivity> top = active.stream()
                .map(connection -> new ConnectionActivity(connection,
                        messageLog.statsForConnectionSince(connection.id(), weekAgo).totalMessages()))
                .sorted(Comparator.comparingLong(ConnectionActivity::messages).reversed())
                .limit(TOP_CONNECTIONS)
                .toList();
        return new ServerStats(serverId, active.size(), maxConnectionsPerServer, monthly, top);
    }
}
