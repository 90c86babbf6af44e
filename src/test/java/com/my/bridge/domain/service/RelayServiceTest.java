package com.my.bridge.domain.service;

import com.my.bridge.adapter.out.persistence.SqliteConnectionRepository;
import com.my.bridge.adapter.out.persistence.SqliteMessageLogRepository;
import com.my.bridge.adapter.out.persistence.SqliteServerSettingsRepository;
import com.my.bridge.adapter.out.persistence.SqliteSpamTrackingRepository;
import com.my.bridge.domain.exception.StorageException;
import com.my.bridge.domain.model.BridgeLimits;
import com.my.bridge.domain.model.ChannelCapability;
import com.my.bridge.domain.model.FilterRules;
import com.my.bridge.domain.model.ForwardEmbed;
import com.my.bridge.domain.model.InboundAttachment;
import com.my.bridge.domain.model.InboundMessage;
import com.my.bridge.domain.model.MessageKind;
import com.my.bridge.domain.model.RelayDecision;
import com.my.bridge.domain.model.RelayResult;
import com.my.bridge.domain.port.in.ServerSettingsUseCase;
import com.my.bridge.domain.port.out.MessageLogRepository;
import com.my.bridge.support.MutableClock;
import com.my.bridge.support.RecordingGateway;
import com.my.bridge.support.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

class RelayServiceTest {

    private static final long ALPHA = 1L;
    private static final long BETA = 2L;
    private static final long GAMMA = 3L;
    private static final long ALPHA_CHANNEL = 11L;
    private static final long BETA_CHANNEL = 22L;
    private static final long GAMMA_CHANNEL = 33L;

    @TempDir
    Path tempDir;

    private SQLiteDataSource dataSource;
    private MutableClock clock;
    private RecordingGateway gateway;
    private BridgeLimits limits;
    private ServerSettingsService settings;
    private ConnectionRegistry registry;
    private SqliteMessageLogRepository messageLog;
    private RelayService service;
    private long lobbyId;
    private long nextMessageId = 1000;

    @BeforeEach
    void setUp() {
        dataSource = TestDatabase.create(tempDir);
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        gateway = new RecordingGateway()
                .channel(ALPHA_CHANNEL, ALPHA, "Alpha")
                .channel(BETA_CHANNEL, BETA, "Beta")
                .channel(GAMMA_CHANNEL, GAMMA, "Gamma");
        limits = new BridgeLimits("!", 5, Duration.ofSeconds(10), 10, 8 * 1024 * 1024, 10, 2000, 7, Duration.ofSeconds(30));
        settings = new ServerSettingsService(new SqliteServerSettingsRepository(dataSource), clock);
        registry = new ConnectionRegistry(new SqliteConnectionRepository(dataSource), clock, limits.maxConnectionsPerServer());
        messageLog = new SqliteMessageLogRepository(dataSource);
        AbuseTracker tracker = new AbuseTracker(new SqliteSpamTrackingRepository(dataSource), clock,
                limits.spamThreshold(), limits.spamWindow());
        ContentFilter filter = new ContentFilter(new FilterRules(Set.of("bit.ly"), List.of("badword"), 3));
        service = new RelayService(settings, tracker, registry, filter, gateway, messageLog, clock, limits);
        lobbyId = registry.create(ALPHA, ALPHA_CHANNEL, BETA, BETA_CHANNEL, "lobby", 500L, "Alpha ↔ Beta");
    }

    @Test
    void forwards_text_with_origin_server_in_author() {
        InboundMessage message = message("hello");

        RelayResult result = service.relay(message);

        assertThat(result).isEqualTo(new RelayResult(RelayDecision.RELAYED, 1));
        assertThat(gateway.sent()).hasSize(1);
        RecordingGateway.Sent sent = gateway.sentTo(BETA_CHANNEL).get(0);
        ForwardEmbed embed = sent.message().embed();
        assertThat(embed.description()).isEqualTo("hello");
        assertThat(embed.authorName()).isEqualTo("alice (Alpha)");
        assertThat(embed.footer()).isEqualTo("연결: lobby • ID: " + lobbyId);
        assertThat(embed.timestamp()).isEqualTo(message.createdAt());
        assertThat(embed.color()).isEqualTo(ForwardEmbed.DEFAULT_COLOR);
        assertThat(messageLog.exists(message.id(), lobbyId)).isTrue();
    }

    @Test
    void forwards_attachment_once_and_logs_hash() throws Exception {
        gateway.attachment("https://cdn.example.com/a.png", new byte[100]);
        InboundMessage message = message("hi", new InboundAttachment("https://cdn.example.com/a.png", 100, "a.png"));

        assertThat(service.relay(message).forwardedCount()).isEqualTo(1);
        assertThat(service.relay(message).forwardedCount()).isZero();

        assertThat(gateway.sent()).hasSize(1);
        assertThat(gateway.sent().get(0).message().files())
                .singleElement()
                .satisfies(file -> {
                    assertThat(file.filename()).isEqualTo("a.png");
                    assertThat(file.data()).hasSize(100);
                });
        assertThat(storedHashes()).containsExactly(RelayService.contentHash(message));
        assertThat(RelayService.contentHash(message))
                .isEqualTo("8f434346648f6b96df89dda901c5176b10a6d83961dd3c1ac88b59b2dc327aa4");
    }

    @Test
    void blocked_link_is_dropped_silently() {
        RelayResult result = service.relay(message("bit.ly/abc"));

        assertThat(result.decision()).isEqualTo(RelayDecision.FILTERED);
        assertThat(gateway.sent()).isEmpty();
        assertThat(messageLog.countAll()).isZero();
    }

    @Test
    void profanity_passes_when_server_turned_the_filter_off() {
        assertThat(service.relay(message("badword")).decision()).isEqualTo(RelayDecision.FILTERED);

        settings.update(ALPHA, "profanity_filter", "false");

        assertThat(service.relay(message("badword")).decision()).isEqualTo(RelayDecision.RELAYED);
    }

    @Test
    void rapid_sender_is_cut_off_after_threshold() {
        List<RelayDecision> decisions = new ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            decisions.add(service.relay(message("msg " + i)).decision());
        }

        assertThat(decisions).containsExactly(
                RelayDecision.RELAYED, RelayDecision.RELAYED, RelayDecision.RELAYED, RelayDecision.RELAYED,
                RelayDecision.SPAM_BLOCKED, RelayDecision.SPAM_BLOCKED);
        assertThat(gateway.sent()).hasSize(4);
    }

    @Test
    void spam_protection_off_skips_counting() {
        settings.update(ALPHA, "spam_protection", "off");

        for (int i = 0; i < 6; i++) {
            assertThat(service.relay(message("msg " + i)).decision()).isEqualTo(RelayDecision.RELAYED);
        }
    }

    @Test
    void ignores_bots_commands_and_system_messages() {
        InboundMessage fromBot = new InboundMessage(nextMessageId++, 9L, true, "bot", null, "beep", List.of(),
                ALPHA_CHANNEL, ALPHA, "Alpha", clock.now(), MessageKind.DEFAULT);
        InboundMessage join = new InboundMessage(nextMessageId++, 9L, false, "bob", null, "", List.of(),
                ALPHA_CHANNEL, ALPHA, "Alpha", clock.now(), MessageKind.SYSTEM);

        assertThat(service.relay(fromBot).decision()).isEqualTo(RelayDecision.IGNORED_AUTOMATED);
        assertThat(service.relay(join).decision()).isEqualTo(RelayDecision.IGNORED_KIND);
        assertThat(service.relay(message("!connect list")).decision()).isEqualTo(RelayDecision.IGNORED_COMMAND);
        assertThat(gateway.sent()).isEmpty();
    }

    @Test
    void server_prefix_override_marks_commands() {
        settings.update(ALPHA, "prefix", "?");

        assertThat(service.relay(message("?stats")).decision()).isEqualTo(RelayDecision.IGNORED_COMMAND);
    }

    @Test
    void disabled_server_relays_nothing() {
        settings.update(ALPHA, "enabled", "false");

        assertThat(service.relay(message("hello")).decision()).isEqualTo(RelayDecision.DISABLED);
        assertThat(gateway.sent()).isEmpty();
    }

    @Test
    void unconnected_channel_stops_early() {
        InboundMessage elsewhere = new InboundMessage(nextMessageId++, 7L, false, "alice", null, "hello", List.of(),
                99L, ALPHA, "Alpha", clock.now(), MessageKind.DEFAULT);

        assertThat(service.relay(elsewhere).decision()).isEqualTo(RelayDecision.NO_CONNECTIONS);
    }

    @Test
    void one_failing_target_does_not_block_the_others() {
        long second = registry.create(ALPHA, ALPHA_CHANNEL, GAMMA, GAMMA_CHANNEL, "hall", 500L, null);
        gateway.failOn(BETA_CHANNEL);

        RelayResult result = service.relay(message("hello"));

        assertThat(result).isEqualTo(new RelayResult(RelayDecision.RELAYED, 1));
        assertThat(gateway.sentTo(GAMMA_CHANNEL)).hasSize(1);
        assertThat(messageLog.exists(nextMessageId - 1, second)).isTrue();
        assertThat(messageLog.exists(nextMessageId - 1, lobbyId)).isFalse();
    }

    @Test
    void log_write_failure_on_one_target_does_not_block_the_others() {
        long second = registry.create(ALPHA, ALPHA_CHANNEL, GAMMA, GAMMA_CHANNEL, "hall", 500L, null);
        MessageLogRepository flakyLog = spy(messageLog);
        doThrow(new StorageException("db locked", null))
                .when(flakyLog).append(argThat(entry -> entry.connectionId() == lobbyId));
        RelayService relay = new RelayService(settings,
                new AbuseTracker(new SqliteSpamTrackingRepository(dataSource), clock, 5, Duration.ofSeconds(10)),
                registry, new ContentFilter(new FilterRules(Set.of(), List.of(), 3)), gateway, flakyLog, clock, limits);

        RelayResult result = relay.relay(message("hello"));

        assertThat(result).isEqualTo(new RelayResult(RelayDecision.RELAYED, 1));
        assertThat(gateway.sentTo(BETA_CHANNEL)).hasSize(1);
        assertThat(gateway.sentTo(GAMMA_CHANNEL)).hasSize(1);
        assertThat(messageLog.exists(nextMessageId - 1, second)).isTrue();
        assertThat(messageLog.exists(nextMessageId - 1, lobbyId)).isFalse();
    }

    @Test
    void target_without_send_permission_is_skipped() {
        gateway.capabilities(BETA_CHANNEL, EnumSet.of(ChannelCapability.VIEW_CHANNEL));

        RelayResult result = service.relay(message("hello"));

        assertThat(result).isEqualTo(new RelayResult(RelayDecision.RELAYED, 0));
        assertThat(gateway.sent()).isEmpty();
    }

    @Test
    void files_are_left_out_where_attaching_is_not_allowed() {
        gateway.attachment("https://cdn.example.com/a.png", new byte[10])
                .capabilities(BETA_CHANNEL, EnumSet.of(ChannelCapability.VIEW_CHANNEL, ChannelCapability.SEND_MESSAGES,
                        ChannelCapability.EMBED_LINKS));

        service.relay(message("hi", new InboundAttachment("https://cdn.example.com/a.png", 10, "a.png")));

        assertThat(gateway.sent()).singleElement().satisfies(sent -> assertThat(sent.message().files()).isEmpty());
    }

    @Test
    void oversized_and_unreadable_attachments_are_dropped() {
        gateway.attachment("https://cdn.example.com/big.bin", new byte[1]);

        service.relay(message("",
                new InboundAttachment("https://cdn.example.com/big.bin", limits.maxFileSize() + 1, "big.bin"),
                new InboundAttachment("https://cdn.example.com/gone.png", 10, "gone.png")));

        RecordingGateway.Sent sent = gateway.sent().get(0);
        assertThat(sent.message().files()).isEmpty();
        assertThat(sent.message().embed().description()).isEqualTo(RelayService.EMPTY_TEXT_PLACEHOLDER);
    }

    @Test
    void attachment_only_message_is_logged_without_hash() throws Exception {
        gateway.attachment("https://cdn.example.com/a.png", new byte[10]);

        service.relay(message("", new InboundAttachment("https://cdn.example.com/a.png", 10, "a.png")));

        assertThat(gateway.sent()).singleElement()
                .satisfies(sent -> assertThat(sent.message().files()).hasSize(1));
        assertThat(storedHashes()).containsExactly((String) null);
    }

    @Test
    void long_text_is_truncated_to_the_limit() {
        String text = "x".repeat(2500);

        service.relay(message(text));

        String description = gateway.sent().get(0).message().embed().description();
        assertThat(description).hasSize(2000).endsWith("...");
    }

    @Test
    void settings_failure_stops_the_relay() {
        ServerSettingsUseCase broken = mock(ServerSettingsUseCase.class);
        when(broken.get(anyLong())).thenThrow(new StorageException("db locked", null));
        RelayService failing = new RelayService(broken,
                new AbuseTracker(new SqliteSpamTrackingRepository(dataSource), clock, 5, Duration.ofSeconds(10)),
                registry, new ContentFilter(new FilterRules(Set.of(), List.of(), 3)), gateway, messageLog, clock, limits);

        assertThatThrownBy(() -> failing.relay(message("hello"))).isInstanceOf(StorageException.class);
        assertThat(gateway.sent()).isEmpty();
    }

    private InboundMessage message(String content, InboundAttachment... attachments) {
        return new InboundMessage(nextMessageId++, 7L, false, "alice", "https://cdn.example.com/alice.png", content,
                List.of(attachments), ALPHA_CHANNEL, ALPHA, "Alpha", clock.now(), MessageKind.DEFAULT);
    }

    private List<String> storedHashes() throws Exception {
        List<String> hashes = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT content_hash FROM message_history")) {
            while (rs.next()) {
                hashes.add(rs.getString(1));
            }
        }
        return hashes;
    }
}
