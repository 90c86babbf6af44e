package com.my.bridge.adapter.out.persistence;

import com.my.bridge.domain.model.Connection;
import com.my.bridge.domain.model.NewConnection;
import com.my.bridge.domain.port.out.ConnectionRepository;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@ApplicationScoped
public class SqliteConnectionRepository implements ConnectionRepository {

    private static final String COLUMNS = "id, server1_id, channel1_id, server2_id, channel2_id, name, created_by, "
            + "description, created_at, is_active";

    private static final String INSERT_SQL = "INSERT INTO connections(server1_id, channel1_id, server2_id, channel2_id, "
            + "name, created_by, description, created_at, is_active) VALUES (?, ?, ?, ?, ?, ?, ?, ?, 1)";
    private static final String FIND_ACTIVE_SQL = "SELECT " + COLUMNS + " FROM connections WHERE id = ? AND is_active = 1";
    private static final String BY_CHANNEL_SQL = "SELECT " + COLUMNS + " FROM connections "
            + "WHERE (channel1_id = ? OR channel2_id = ?) AND is_active = 1 ORDER BY id";
    private static final String BY_SERVER_SQL = "SELECT " + COLUMNS + " FROM connections "
            + "WHERE (server1_id = ? OR server2_id = ?) AND is_active = 1 ORDER BY created_at DESC, id DESC";
    private static final String PAIR_EXISTS_SQL = "SELECT 1 FROM connections WHERE is_active = 1 AND "
            + "((channel1_id = ? AND channel2_id = ?) OR (channel1_id = ? AND channel2_id = ?)) LIMIT 1";
    private static final String COUNT_FOR_SERVER_SQL = "SELECT COUNT(*) FROM connections "
            + "WHERE (server1_id = ? OR server2_id = ?) AND is_active = 1";
    private static final String COUNT_ACTIVE_SQL = "SELECT COUNT(*) FROM connections WHERE is_active = 1";
    private static final String DEACTIVATE_SQL = "UPDATE connections SET is_active = 0 WHERE id = ? AND is_active = 1";
    private static final String DEACTIVATE_SERVER_SQL = "UPDATE connections SET is_active = 0 "
            + "WHERE (server1_id = ? OR server2_id = ?) AND is_active = 1";

    private final Jdbc jdbc;

    public SqliteConnectionRepository(DataSource dataSource) {
        this.jdbc = new Jdbc(dataSource);
    }

    @Override
    public long insert(NewConnection connection, Instant createdAt) {
        return jdbc.insert(INSERT_SQL,
                connection.server1Id(), connection.channel1Id(),
                connection.server2Id(), connection.channel2Id(),
                connection.name(), connection.createdBy(), connection.description(),
                createdAt.toEpochMilli());
    }

    @Override
    public Optional<Connection> findActiveById(long id) {
        return jdbc.queryOne(FIND_ACTIVE_SQL, SqliteConnectionRepository::map, id);
    }

    @Override
    public List<Connection> listActiveByChannel(long channelId) {
        return jdbc.query(BY_CHANNEL_SQL, SqliteConnectionRepository::map, channelId, channelId);
    }

    @Override
    public List<Connection> listActiveByServer(long serverId) {
        return jdbc.query(BY_SERVER_SQL, SqliteConnectionRepository::map, serverId, serverId);
    }

    @Override
    public boolean existsActivePair(long channelA, long channelB) {
        return jdbc.queryOne(PAIR_EXISTS_SQL, rs -> Boolean.TRUE, channelA, channelB, channelB, channelA).isPresent();
    }

    @Override
    public int countActiveForServer(long serverId) {
        return (int) jdbc.queryLong(COUNT_FOR_SERVER_SQL, serverId, serverId);
    }

    @Override
    public long countActive() {
        return jdbc.queryLong(COUNT_ACTIVE_SQL);
    }

    @Override
    public boolean deactivate(long id) {
        return jdbc.update(DEACTIVATE_SQL, id) > 0;
    }

    @Override
    public int deactivateAllForServer(long serverId) {
        return jdbc.update(DEACTIVATE_SERVER_SQL, serverId, serverId);
    }

    static Connection map(ResultSet rs) throws SQLException {
        return new Connection(
                rs.getLong("id"),
                rs.getLong("server1_id"),
                rs.getLong("channel1_id"),
                rs.getLong("server2_id"),
                rs.getLong("channel2_id"),
                rs.getString("name"),
                rs.getLong("created_by"),
                rs.getString("description"),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                rs.getInt("is_active") == 1);
    }
}
