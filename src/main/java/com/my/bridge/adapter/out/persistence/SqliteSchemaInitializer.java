package com.my.bridge.adapter.out.persistence;

import com.my.bridge.domain.exception.StorageException;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * 왜: 저장소 어댑터가 쓰는 테이블과 인덱스를 기동 시점에 한 번 보장하기 위함. 모든 DDL은 IF NOT EXISTS라 재실행해도 안전하다.
 */
@Startup
@ApplicationScoped
public class SqliteSchemaInitializer {

    private static final Logger log = Logger.getLogger(SqliteSchemaInitializer.class);

    static final List<String> DDL = List.of(
            """
            CREATE TABLE IF NOT EXISTS connections (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                server1_id INTEGER NOT NULL,
                channel1_id INTEGER NOT NULL,
                server2_id INTEGER NOT NULL,
                channel2_id INTEGER NOT NULL,
                name TEXT NOT NULL,
                created_by INTEGER NOT NULL,
                description TEXT,
                created_at INTEGER NOT NULL,
                is_active INTEGER NOT NULL DEFAULT 1
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS message_history (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                original_message_id INTEGER NOT NULL,
                forwarded_message_id INTEGER NOT NULL,
                author_id INTEGER NOT NULL,
                connection_id INTEGER NOT NULL REFERENCES connections(id),
                timestamp INTEGER NOT NULL,
                content_hash TEXT
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS server_settings (
                server_id INTEGER PRIMARY KEY,
                prefix TEXT,
                enabled INTEGER NOT NULL DEFAULT 1,
                mod_role_id INTEGER,
                log_channel_id INTEGER,
                spam_protection INTEGER NOT NULL DEFAULT 1,
                profanity_filter INTEGER NOT NULL DEFAULT 1,
                auto_delete_commands INTEGER NOT NULL DEFAULT 0,
                webhook_notifications INTEGER NOT NULL DEFAULT 0,
                created_at INTEGER NOT NULL,
                updated_at INTEGER NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS spam_tracking (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                user_id INTEGER NOT NULL,
                server_id INTEGER NOT NULL,
                channel_id INTEGER NOT NULL,
                message_count INTEGER NOT NULL DEFAULT 1,
                first_message_time INTEGER NOT NULL,
                last_message_time INTEGER NOT NULL,
                is_blocked INTEGER NOT NULL DEFAULT 0,
                UNIQUE (user_id, server_id, channel_id)
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_connections_active ON connections(is_active)",
            "CREATE INDEX IF NOT EXISTS idx_connections_channels ON connections(channel1_id, channel2_id)",
            "CREATE INDEX IF NOT EXISTS idx_message_history_connection ON message_history(connection_id)",
            "CREATE INDEX IF NOT EXISTS idx_spam_tracking_user_server ON spam_tracking(user_id, server_id)");

    private final DataSource dataSource;

    public SqliteSchemaInitializer(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @PostConstruct
    public void init() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            for (String ddl : DDL) {
                stmt.execute(ddl);
            }
        } catch (SQLException e) {
            throw new StorageException("스키마 초기화 실패", e);
        }
        log.info("SQLite 스키마 준비 완료");
    }
}
