package com.my.bridge.adapter.out.health;

import com.my.bridge.adapter.out.discord.DiscordRestClient;
import com.my.bridge.support.TestDatabase;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BridgeReadinessCheckTest {

    @TempDir
    Path tempDir;

    @Test
    void up_when_database_reachable_and_token_present() {
        DiscordRestClient discord = mock(DiscordRestClient.class);
        when(discord.configured()).thenReturn(true);

        HealthCheckResponse response = new BridgeReadinessCheck(TestDatabase.create(tempDir), discord).call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData()).hasValueSatisfying(data -> {
            assertThat(data).containsEntry("database", true);
            assertThat(data).containsEntry("discordToken", true);
        });
    }

    @Test
    void down_without_token() {
        DiscordRestClient discord = mock(DiscordRestClient.class);
        when(discord.configured()).thenReturn(false);

        HealthCheckResponse response = new BridgeReadinessCheck(TestDatabase.create(tempDir), discord).call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
    }

    @Test
    void down_when_database_unreachable() throws Exception {
        DataSource dataSource = mock(DataSource.class);
        when(dataSource.getConnection()).thenThrow(new SQLException("closed"));
        DiscordRestClient discord = mock(DiscordRestClient.class);
        when(discord.configured()).thenReturn(true);

        HealthCheckResponse response = new BridgeReadinessCheck(dataSource, discord).call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
    }
}
