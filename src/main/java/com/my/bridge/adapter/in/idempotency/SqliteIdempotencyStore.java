package com.my.bridge.adapter.in.idempotency;

import com.my.bridge.config.AppConfig;
import com.my.bridge.domain.exception.StorageException;
import com.my.bridge.domain.port.out.ClockPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;

/**
 * 왜: 재시작 후에도 이미 중계한 게이트웨이 이벤트를 다시 처리하지 않도록 중계 DB 파일에 이벤트 ID를 남긴다.
 */
@IfBuildProperty(name = "app.idempotency.backend", stringValue = "sqlite", enableIfMissing = true)
@ApplicationScoped
public class SqliteIdempotencyStore implements IdempotencyStore {

    private static final String TABLE_DDL = """
            CREATE TABLE IF NOT EXISTS processed_events (
                event_id TEXT PRIMARY KEY,
                processed_at INTEGER NOT NULL
            )
            """;

    private static final String INSERT_SQL = "INSERT OR IGNORE INTO processed_events(event_id, processed_at) VALUES (?, ?)";
    private static final String SELECT_SQL = "SELECT 1 FROM processed_events WHERE event_id = ? AND processed_at >= ?";
    private static final String CLEANUP_SQL = "DELETE FROM processed_events WHERE processed_at < ?";

    private final DataSource dataSource;
    private final ClockPort clockPort;
    private final Duration ttl;

    @Inject
    public SqliteIdempotencyStore(DataSource dataSource, ClockPort clockPort, AppConfig appConfig) {
        this(dataSource, clockPort, Duration.ofHours(appConfig.idempotency().ttlHours()));
    }

    SqliteIdempotencyStore(DataSource dataSource, ClockPort clockPort, Duration ttl) {
        this.dataSource = dataSource;
        this.clockPort = clockPort;
        this.ttl = ttl;
    }

    @PostConstruct
    void init() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(TABLE_DDL);
        } catch (SQLException e) {
            throw new StorageException("Idempotency 테이블 초기화 실패", e);
        }
    }

    @Override
    public boolean isProcessed(String eventId) {
        Instant cutoff = cleanup();
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_SQL)) {
            ps.setString(1, eventId);
            ps.setLong(2, cutoff.toEpochMilli());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new StorageException("Idempotency 조회 실패", e);
        }
    }

    @Override
    public void markProcessed(String eventId) {
        cleanup();
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
            ps.setString(1, eventId);
            ps.setLong(2, clockPort.now().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Idempotency 기록 실패", e);
        }
    }

    private Instant cleanup() {
        Instant cutoff = clockPort.now().minus(ttl);
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(CLEANUP_SQL)) {
            ps.setLong(1, cutoff.toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Idempotency 정리 실패", e);
        }
        return cutoff;
    }
}
