package com.my.bridge.adapter.out.persistence;

import com.my.bridge.domain.model.ServerSettings;
import com.my.bridge.domain.port.out.ServerSettingsRepository;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

/**
 * 왜: 설정 변경은 항상 행 전체를 고정된 UPDATE 한 문장으로 쓴다. 컬럼 이름을 동적으로 조합하지 않는다.
 */
@ApplicationScoped
public class SqliteServerSettingsRepository implements ServerSettingsRepository {

    private static final String FIND_SQL = "SELECT server_id, prefix, enabled, mod_role_id, log_channel_id, "
            + "spam_protection, profanity_filter, auto_delete_commands, webhook_notifications, created_at, updated_at "
            + "FROM server_settings WHERE server_id = ?";
    private static final String INSERT_IF_ABSENT_SQL = "INSERT INTO server_settings(server_id, prefix, enabled, "
            + "mod_role_id, log_channel_id, spam_protection, profanity_filter, auto_delete_commands, "
            + "webhook_notifications, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) "
            + "ON CONFLICT(server_id) DO NOTHING";
    private static final String UPDATE_SQL = "UPDATE server_settings SET prefix = ?, enabled = ?, mod_role_id = ?, "
            + "log_channel_id = ?, spam_protection = ?, profanity_filter = ?, auto_delete_commands = ?, "
            + "webhook_notifications = ?, updated_at = ? WHERE server_id = ?";
    private static final String COUNT_SQL = "SELECT COUNT(*) FROM server_settings";

    private final Jdbc jdbc;

    public SqliteServerSettingsRepository(DataSource dataSource) {
        this.jdbc = new Jdbc(dataSource);
    }

    @Override
    public Optional<ServerSettings> find(long serverId) {
        return jdbc.queryOne(FIND_SQL, SqliteServerSettingsRepository::map, serverId);
    }

    @Override
    public void insertIfAbsent(ServerSettings defaults) {
        jdbc.update(INSERT_IF_ABSENT_SQL,
                defaults.serverId(),
                defaults.prefix(),
                defaults.enabled(),
                defaults.modRoleId(),
                defaults.logChannelId(),
                defaults.spamProtection(),
                defaults.profanityFilter(),
                defaults.autoDeleteCommands(),
                defaults.webhookNotifications(),
                defaults.createdAt().toEpochMilli(),
                defaults.updatedAt().toEpochMilli());
    }

    @Override
    public void update(ServerSettings settings) {
        jdbc.update(UPDATE_SQL,
                settings.prefix(),
                settings.enabled(),
                settings.modRoleId(),
                settings.logChannelId(),
                settings.spamProtection(),
                settings.profanityFilter(),
                settings.autoDeleteCommands(),
                settings.webhookNotifications(),
                settings.updatedAt().toEpochMilli(),
                settings.serverId());
    }

    @Override
    public long count() {
        return jdbc.queryLong(COUNT_SQL);
    }

    static ServerSettings map(ResultSet rs) throws SQLException {
        return new ServerSettings(
                rs.getLong("server_id"),
                rs.getString("prefix"),
                rs.getInt("enabled") == 1,
                Jdbc.nullableLong(rs, "mod_role_id"),
                Jdbc.nullableLong(rs, "log_channel_id"),
                rs.getInt("spam_protection") == 1,
                rs.getInt("profanity_filter") == 1,
                rs.getInt("auto_delete_commands") == 1,
                rs.getInt("webhook_notifications") == 1,
                Instant.ofEpochMilli(rs.getLong("created_at")),
                Instant.ofEpochMilli(rs.getLong("updated_at")));
    }
}
