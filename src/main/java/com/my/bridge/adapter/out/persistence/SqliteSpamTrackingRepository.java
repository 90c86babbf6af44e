package com.my.bridge.adapter.out.persistence;

import com.my.bridge.domain.model.SpamKey;
import com.my.bridge.domain.model.SpamTrackingEntry;
import com.my.bridge.domain.port.out.SpamTrackingRepository;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

/**
 * 왜: 재시작 후에도 차단 상태가 윈도우 동안 유지되도록 카운터를 SQLite에 둔다.
 */
@IfBuildProperty(name = "app.spam.backend", stringValue = "sqlite", enableIfMissing = true)
@ApplicationScoped
public class SqliteSpamTrackingRepository implements SpamTrackingRepository {

    private static final String FIND_SQL = "SELECT user_id, server_id, channel_id, message_count, first_message_time, "
            + "last_message_time, is_blocked FROM spam_tracking WHERE user_id = ? AND server_id = ? AND channel_id = ?";
    private static final String UPSERT_SQL = "INSERT INTO spam_tracking(user_id, server_id, channel_id, message_count, "
            + "first_message_time, last_message_time, is_blocked) VALUES (?, ?, ?, ?, ?, ?, ?) "
            + "ON CONFLICT(user_id, server_id, channel_id) DO UPDATE SET message_count = excluded.message_count, "
            + "first_message_time = excluded.first_message_time, last_message_time = excluded.last_message_time, "
            + "is_blocked = excluded.is_blocked";
    private static final String DELETE_BEFORE_SQL = "DELETE FROM spam_tracking WHERE last_message_time < ?";

    private final Jdbc jdbc;

    public SqliteSpamTrackingRepository(DataSource dataSource) {
        this.jdbc = new Jdbc(dataSource);
    }

    @Override
    public Optional<SpamTrackingEntry> find(SpamKey key) {
        return jdbc.queryOne(FIND_SQL, SqliteSpamTrackingRepository::map, key.userId(), key.serverId(), key.channelId());
    }

    @Override
    public void save(SpamTrackingEntry entry) {
        SpamKey key = entry.key();
        jdbc.update(UPSERT_SQL,
                key.userId(),
                key.serverId(),
                key.channelId(),
                entry.messageCount(),
                entry.firstMessageTime().toEpochMilli(),
                entry.lastMessageTime().toEpochMilli(),
                entry.blocked());
    }

    @Override
    public int deleteLastSeenBefore(Instant cutoff) {
        return jdbc.update(DELETE_BEFORE_SQL, cutoff.toEpochMilli());
    }

    static SpamTrackingEntry map(ResultSet rs) throws SQLException {
        return new SpamTrackingEntry(
                new SpamKey(rs.getLong("user_id"), rs.getLong("server_id"), rs.getLong("channel_id")),
                rs.getInt("message_count"),
                Instant.ofEpochMilli(rs.getLong("first_message_time")),
                Instant.ofEpochMilli(rs.getLong("last_message_time")),
                rs.getInt("is_blocked") == 1);
    }
}
