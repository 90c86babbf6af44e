package com.my.bridge.adapter.out.persistence;

import com.my.bridge.domain.model.MessageLogEntry;
import com.my.bridge.domain.model.MessageStats;
import com.my.bridge.domain.port.out.MessageLogRepository;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;

/**
 * 왜: 전달 기록은 추가만 하고 수정하지 않는다. 통계는 같은 테이블의 집계 쿼리로 만든다.
 */
@ApplicationScoped
public class SqliteMessageLogRepository implements MessageLogRepository {

    private static final String INSERT_SQL = "INSERT INTO message_history(original_message_id, forwarded_message_id, "
            + "author_id, connection_id, timestamp, content_hash) VALUES (?, ?, ?, ?, ?, ?)";
    private static final String EXISTS_SQL = "SELECT 1 FROM message_history "
            + "WHERE original_message_id = ? AND connection_id = ? LIMIT 1";
    private static final String STATS_SQL = "SELECT COUNT(*) AS total_messages, COUNT(DISTINCT author_id) AS unique_users, "
            + "COUNT(DISTINCT connection_id) AS active_connections FROM message_history WHERE timestamp > ?";
    private static final String CONNECTION_STATS_SQL = "SELECT COUNT(*) AS total_messages, "
            + "COUNT(DISTINCT author_id) AS unique_users, COUNT(DISTINCT connection_id) AS active_connections "
            + "FROM message_history WHERE connection_id = ? AND timestamp > ?";
    private static final String COUNT_SQL = "SELECT COUNT(*) FROM message_history";

    private final Jdbc jdbc;

    public SqliteMessageLogRepository(DataSource dataSource) {
        this.jdbc = new Jdbc(dataSource);
    }

    @Override
    public void append(MessageLogEntry entry) {
        jdbc.update(INSERT_SQL,
                entry.originalMessageId(),
                entry.forwardedMessageId(),
                entry.authorId(),
                entry.connectionId(),
                entry.timestamp().toEpochMilli(),
                entry.contentHash());
    }

    @Override
    public boolean exists(long originalMessageId, long connectionId) {
        return jdbc.queryOne(EXISTS_SQL, rs -> Boolean.TRUE, originalMessageId, connectionId).isPresent();
    }

    @Override
    public MessageStats statsSince(Instant since) {
        return jdbc.queryOne(STATS_SQL, SqliteMessageLogRepository::mapStats, since.toEpochMilli())
                .orElse(MessageStats.empty());
    }

    @Override
    public MessageStats statsForConnectionSince(long connectionId, Instant since) {
        return jdbc.queryOne(CONNECTION_STATS_SQL, SqliteMessageLogRepository::mapStats, connectionId, since.toEpochMilli())
                .orElse(MessageStats.empty());
    }

    @Override
    public long countAll() {
        return jdbc.queryLong(COUNT_SQL);
    }

    private static MessageStats mapStats(ResultSet rs) throws SQLException {
        return new MessageStats(
                rs.getLong("total_messages"),
                rs.getLong("unique_users"),
                rs.getLong("active_connections"));
    }
}
