package com.my.bridge.domain.service;

import com.my.bridge.domain.exception.NotFoundException;
import com.my.bridge.domain.exception.PermissionDeniedException;
import com.my.bridge.domain.exception.TransportException;
import com.my.bridge.domain.model.Actor;
import com.my.bridge.domain.model.ChannelCapability;
import com.my.bridge.domain.model.ChannelInfo;
import com.my.bridge.domain.model.ConfirmationState;
import com.my.bridge.domain.model.Connection;
import com.my.bridge.domain.model.ConnectionDetails;
import com.my.bridge.domain.model.ConnectionDiagnostics;
import com.my.bridge.domain.model.ConnectionPage;
import com.my.bridge.domain.model.DiagnosticStatus;
import com.my.bridge.domain.model.MessageStats;
import com.my.bridge.domain.model.OutgoingMessage;
import com.my.bridge.domain.model.PendingConfirmation;
import com.my.bridge.domain.model.RemovalResult;
import com.my.bridge.domain.port.in.ConnectionAdminUseCase;
import com.my.bridge.domain.port.in.ServerSettingsUseCase;
import com.my.bridge.domain.port.out.ChatGatewayPort;
import com.my.bridge.domain.port.out.ClockPort;
import com.my.bridge.domain.port.out.MessageLogRepository;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionStage;

/**
 * 왜: 연결 관리 명령(생성, 목록, 상세, 점검, 삭제)의 업무 규칙과 플랫폼 권한 확인을 레지스트리 위에 모으기 위함.
 */
public class ConnectionAdminService implements ConnectionAdminUseCase {

    private static final Logger log = Logger.getLogger(ConnectionAdminService.class);

    static final int PAGE_SIZE = 5;
    static final Set<ChannelCapability> REQUIRED_FOR_CREATE = EnumSet.of(
            ChannelCapability.SEND_MESSAGES,
            ChannelCapability.EMBED_LINKS,
            ChannelCapability.ATTACH_FILES,
            ChannelCapability.READ_MESSAGE_HISTORY);
    static final Set<ChannelCapability> REQUIRED_FOR_RELAY = EnumSet.of(
            ChannelCapability.SEND_MESSAGES,
            ChannelCapability.EMBED_LINKS,
            ChannelCapability.ATTACH_FILES);

    private final ConnectionRegistry registry;
    private final ServerSettingsUseCase serverSettings;
    private final MessageLogRepository messageLog;
    private final ConfirmationService confirmations;
    private final ChatGatewayPort gateway;
    private final ClockPort clockPort;

    public ConnectionAdminService(ConnectionRegistry registry,
                                  ServerSettingsUseCase serverSettings,
                                  MessageLogRepository messageLog,
                                  ConfirmationService confirmations,
                                  ChatGatewayPort gateway,
                                  ClockPort clockPort) {
        this.registry = registry;
        this.serverSettings = serverSettings;
        this.messageLog = messageLog;
        this.confirmations = confirmations;
        this.gateway = gateway;
        this.clockPort = clockPort;
    }

    @Override
    public Connection create(Actor actor, long targetChannelId, String name) {
        ChannelInfo target = gateway.findChannel(targetChannelId)
                .orElseThrow(() -> new NotFoundException("대상 채널을 찾을 수 없습니다: " + targetChannelId));
        Set<ChannelCapability> missing = EnumSet.copyOf(REQUIRED_FOR_CREATE);
        missing.removeAll(gateway.channelCapabilities(targetChannelId));
        if (!missing.isEmpty()) {
            throw new PermissionDeniedException("대상 채널에서 봇 권한이 부족합니다: " + missing, missing);
        }
        String sourceGuildName = gateway.findChannel(actor.channelId())
                .map(ChannelInfo::guildName)
                .orElse(String.valueOf(actor.guildId()));
        String description = sourceGuildName + " ↔ " + Optional.ofNullable(target.guildName()).orElse(String.valueOf(target.guildId()));
        long id = registry.create(actor.guildId(), actor.channelId(), target.guildId(), target.id(), name, actor.userId(), description);
        Connection created = registry.getById(id);
        notify(target.id(), "🔗 새 연결이 설정되었습니다: **" + created.name() + "** (ID: " + id + ")");
        return created;
    }

    @Override
    public ConnectionPage list(Actor actor, int page) {
        List<Connection> all = registry.listByServer(actor.guildId());
        int totalPages = Math.max(1, (all.size() + PAGE_SIZE - 1) / PAGE_SIZE);
        int current = Math.max(1, Math.min(page, totalPages));
        int from = Math.min((current - 1) * PAGE_SIZE, all.size());
        int to = Math.min(from + PAGE_SIZE, all.size());
        return new ConnectionPage(all.subList(from, to), current, totalPages, all.size());
    }

    @Override
    public ConnectionDetails info(Actor actor, long connectionId) {
        Connection connection = accessible(actor, connectionId);
        MessageStats stats = messageLog.statsForConnectionSince(connectionId, clockPort.now().minus(Duration.ofDays(7)));
        return new ConnectionDetails(connection, stats);
    }

    @Override
    public ConnectionDiagnostics test(Actor actor, long connectionId) {
        Connection connection = accessible(actor, connectionId);
        boolean first = reachable(connection.channel1Id());
        boolean second = reachable(connection.channel2Id());
        DiagnosticStatus channels = first && second ? DiagnosticStatus.OK
                : first || second ? DiagnosticStatus.WARNING : DiagnosticStatus.FAILED;

        boolean permissionsOk = (!first || hasRelayCapabilities(connection.channel1Id()))
                && (!second || hasRelayCapabilities(connection.channel2Id()));
        DiagnosticStatus permissions = permissionsOk ? DiagnosticStatus.OK : DiagnosticStatus.FAILED;

        boolean enabled = serverSettings.get(connection.server1Id()).enabled()
                && serverSettings.get(connection.server2Id()).enabled();
        DiagnosticStatus settings = enabled ? DiagnosticStatus.OK : DiagnosticStatus.WARNING;

        DiagnosticStatus state = connection.active() ? DiagnosticStatus.OK : DiagnosticStatus.FAILED;
        return new ConnectionDiagnostics(connection, channels, permissions, settings, state);
    }

    @Override
    public Removal requestRemoval(Actor actor, long connectionId) {
        Connection connection = registry.getById(connectionId);
        boolean creator = connection.createdBy() == actor.userId();
        boolean endpointAdmin = actor.administrator() && connection.touchesServer(actor.guildId());
        if (!creator && !endpointAdmin) {
            throw new PermissionDeniedException("연결은 생성자 또는 연결된 서버의 관리자만 삭제할 수 있습니다.");
        }
        PendingConfirmation pending = confirmations.begin(actor.userId(), "connection-remove:" + connectionId);
        CompletionStage<RemovalResult> result = pending.outcome().thenApply(state -> {
            if (state != ConfirmationState.CONFIRMED) {
                return new RemovalResult(connection, state, false);
            }
            boolean removed = registry.softDelete(connectionId);
            if (removed) {
                notify(connection.oppositeChannel(actor.channelId()),
                        "ℹ️ 연결 **" + connection.name() + "** 이(가) 삭제되었습니다.");
            }
            return new RemovalResult(connection, state, removed);
        });
        return new Removal(pending, result);
    }

    private Connection accessible(Actor actor, long connectionId) {
        Connection connection = registry.getById(connectionId);
        if (!connection.touchesServer(actor.guildId())) {
            throw new PermissionDeniedException("자기 서버의 연결만 조회할 수 있습니다.");
        }
        return connection;
    }

    private boolean reachable(long channelId) {
        try {
            return gateway.findChannel(channelId).isPresent();
        } catch (TransportException e) {
            log.warnf("채널 %d 조회 실패: %s", channelId, e.getMessage());
            return false;
        }
    }

    private boolean hasRelayCapabilities(long channelId) {
        try {
            return gateway.channelCapabilities(channelId).containsAll(REQUIRED_FOR_RELAY);
        } catch (TransportException e) {
            log.warnf("채널 %d 권한 조회 실패: %s", channelId, e.getMessage());
            return false;
        }
    }

    private void notify(long channelId, String text) {
        try {
            gateway.send(channelId, OutgoingMessage.text(text));
        } catch (PermissionDeniedException | TransportException e) {
            log.warnf("채널 %d 알림 전송 실패: %s", channelId, e.getMessage());
        }
    }
}
