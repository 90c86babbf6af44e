package com.my.bridge.adapter.out.health;

import com.my.bridge.adapter.out.discord.DiscordRestClient;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

@Readiness
@ApplicationScoped
public class BridgeReadinessCheck implements HealthCheck {

    private final DataSource dataSource;
    private final DiscordRestClient discordRestClient;

    public BridgeReadinessCheck(DataSource dataSource, DiscordRestClient discordRestClient) {
        this.dataSource = dataSource;
        this.discordRestClient = discordRestClient;
    }

    @Override
    public HealthCheckResponse call() {
        boolean databaseOk = databaseReachable();
        boolean tokenOk = discordRestClient.configured();
        return HealthCheckResponse.named("bridge-readiness")
                .withData("database", databaseOk)
                .withData("discordToken", tokenOk)
                .status(databaseOk && tokenOk)
                .build();
    }

    private boolean databaseReachable() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            return false;
        }
    }
}
