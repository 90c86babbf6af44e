package com.my.bridge.adapter.out.persistence;

import com.my.bridge.domain.exception.StorageException;
import com.my.bridge.domain.model.MessageLogEntry;
import com.my.bridge.domain.model.MessageStats;
import com.my.bridge.domain.model.NewConnection;
import com.my.bridge.support.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqliteMessageLogRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-08T00:00:00Z");

    @TempDir
    Path tempDir;

    private SqliteMessageLogRepository messageLog;
    private long first;
    private long second;

    @BeforeEach
    void setUp() {
        SQLiteDataSource dataSource = TestDatabase.create(tempDir);
        SqliteConnectionRepository connections = new SqliteConnectionRepository(dataSource);
        first = connections.insert(new NewConnection(1L, 11L, 2L, 22L, "one", 9L, null), NOW);
        second = connections.insert(new NewConnection(1L, 12L, 3L, 33L, "two", 9L, null), NOW);
        messageLog = new SqliteMessageLogRepository(dataSource);
    }

    @Test
    void exists_is_per_message_and_connection() {
        messageLog.append(new MessageLogEntry(100L, 200L, 7L, first, NOW, "abc"));

        assertThat(messageLog.exists(100L, first)).isTrue();
        assertThat(messageLog.exists(100L, second)).isFalse();
        assertThat(messageLog.exists(101L, first)).isFalse();
    }

    @Test
    void stats_count_messages_users_and_connections_inside_window() {
        messageLog.append(new MessageLogEntry(1L, 2L, 7L, first, NOW.minus(Duration.ofDays(1)), null));
        messageLog.append(new MessageLogEntry(3L, 4L, 7L, second, NOW.minus(Duration.ofDays(2)), null));
        messageLog.append(new MessageLogEntry(5L, 6L, 8L, second, NOW.minus(Duration.ofDays(3)), null));
        messageLog.append(new MessageLogEntry(7L, 8L, 9L, first, NOW.minus(Duration.ofDays(10)), null));

        Instant weekAgo = NOW.minus(Duration.ofDays(7));

        assertThat(messageLog.statsSince(weekAgo)).isEqualTo(new MessageStats(3, 2, 2));
        assertThat(messageLog.statsForConnectionSince(second, weekAgo)).isEqualTo(new MessageStats(2, 2, 1));
        assertThat(messageLog.countAll()).isEqualTo(4);
    }

    @Test
    void empty_window_is_zero() {
        assertThat(messageLog.statsSince(NOW)).isEqualTo(MessageStats.empty());
    }

    @Test
    void unknown_connection_violates_foreign_key() {
        assertThatThrownBy(() -> messageLog.append(new MessageLogEntry(1L, 2L, 7L, 999L, NOW, null)))
                .isInstanceOf(StorageException.class);
    }
}
