package com.my.bridge.domain.service;

import com.my.bridge.domain.model.BotStats;
import com.my.bridge.domain.model.Connection;
import com.my.bridge.domain.model.ConnectionActivity;
import com.my.bridge.domain.model.MessageStats;
import com.my.bridge.domain.model.ProcessMetrics;
import com.my.bridge.domain.model.ServerStats;
import com.my.bridge.domain.port.out.ConnectionRepository;
import com.my.bridge.domain.port.out.MessageLogRepository;
import com.my.bridge.domain.port.out.RuntimeMetricsPort;
import com.my.bridge.domain.port.out.ServerSettingsRepository;
import com.my.bridge.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StatsServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-31T00:00:00Z");
    private static final Instant WEEK_AGO = NOW.minus(Duration.ofDays(7));
    private static final Instant MONTH_AGO = NOW.minus(Duration.ofDays(30));

    private ConnectionRepository connections;
    private MessageLogRepository messageLog;
    private ServerSettingsRepository settings;
    private RuntimeMetricsPort runtimeMetrics;
    private StatsService service;

    @BeforeEach
    void setUp() {
        connections = mock(ConnectionRepository.class);
        messageLog = mock(MessageLogRepository.class);
        settings = mock(ServerSettingsRepository.class);
        runtimeMetrics = mock(RuntimeMetricsPort.class);
        service = new StatsService(connections, messageLog, settings, runtimeMetrics, new MutableClock(NOW), 10);
    }

    @Test
    void bot_stats_combine_database_week_and_process() {
        ProcessMetrics process = new ProcessMetrics(120.5, 512.0, 33, 4, Duration.ofHours(3));
        when(connections.countActive()).thenReturn(4L);
        when(messageLog.countAll()).thenReturn(1200L);
        when(settings.count()).thenReturn(6L);
        when(messageLog.statsSince(WEEK_AGO)).thenReturn(new MessageStats(80, 12, 3));
        when(runtimeMetrics.snapshot()).thenReturn(process);

        BotStats stats = service.botStats();

        assertThat(stats.database().activeConnections()).isEqualTo(4);
        assertThat(stats.database().totalMessages()).isEqualTo(1200);
        assertThat(stats.database().totalServers()).isEqualTo(6);
        assertThat(stats.lastWeek()).isEqualTo(new MessageStats(80, 12, 3));
        assertThat(stats.process()).isEqualTo(process);
    }

    @Test
    void server_stats_sum_month_and_rank_top_three_by_week() {
        Connection a = connection(1);
        Connection b = connection(2);
        Connection c = connection(3);
        Connection d = connection(4);
        when(connections.listActiveByServer(5L)).thenReturn(List.of(a, b, c, d));
        weekly(a, 5);
        weekly(b, 40);
        weekly(c, 0);
        weekly(d, 12);
        monthly(a, 10);
        monthly(b, 100);
        monthly(c, 3);
        monthly(d, 20);

        ServerStats stats = service.serverStats(5L);

        assertThat(stats.activeConnections()).isEqualTo(4);
        assertThat(stats.connectionLimit()).isEqualTo(10);
        assertThat(stats.freeSlots()).isEqualTo(6);
        assertThat(stats.messagesLastMonth()).isEqualTo(133);
        assertThat(stats.topConnections()).extracting(ConnectionActivity::messages).containsExactly(40L, 12L, 5L);
        assertThat(stats.topConnections()).extracting(activity -> activity.connection().id()).containsExactly(2L, 4L, 1L);
    }

    @Test
    void server_without_connections_has_empty_stats() {
        when(connections.listActiveByServer(5L)).thenReturn(List.of());

        ServerStats stats = service.serverStats(5L);

        assertThat(stats.messagesLastMonth()).isZero();
        assertThat(stats.topConnections()).isEmpty();
        assertThat(stats.freeSlots()).isEqualTo(10);
    }

    private void weekly(Connection connection, long count) {
        when(messageLog.statsForConnectionSince(eq(connection.id()), eq(WEEK_AGO))).thenReturn(new MessageStats(count, 1, 1));
    }

    private void monthly(Connection connection, long count) {
        when(messageLog.statsForConnectionSince(eq(connection.id()), eq(MONTH_AGO))).thenReturn(new MessageStats(count, 1, 1));
    }

    private static Connection connection(long id) {
        return new Connection(id, 5L, 50L + id, 100L + id, 1000L + id, "link-" + id, 9L, null, NOW, true);
    }
}
