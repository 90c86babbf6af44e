package com.my.bridge.domain.service;

import com.my.bridge.domain.exception.PermissionDeniedException;
import com.my.bridge.domain.exception.StorageException;
import com.my.bridge.domain.exception.TransportException;
import com.my.bridge.domain.model.BridgeLimits;
import com.my.bridge.domain.model.ChannelCapability;
import com.my.bridge.domain.model.ChannelInfo;
import com.my.bridge.domain.model.Connection;
import com.my.bridge.domain.model.FilterOptions;
import com.my.bridge.domain.model.FilterVerdict;
import com.my.bridge.domain.model.ForwardEmbed;
import com.my.bridge.domain.model.InboundAttachment;
import com.my.bridge.domain.model.InboundMessage;
import com.my.bridge.domain.model.MessageLogEntry;
import com.my.bridge.domain.model.OutgoingFile;
import com.my.bridge.domain.model.OutgoingMessage;
import com.my.bridge.domain.model.RelayDecision;
import com.my.bridge.domain.model.RelayResult;
import com.my.bridge.domain.model.ServerSettings;
import com.my.bridge.domain.model.SpamCheckResult;
import com.my.bridge.domain.port.in.RelayMessageUseCase;
import com.my.bridge.domain.port.in.ServerSettingsUseCase;
import com.my.bridge.domain.port.out.ChatGatewayPort;
import com.my.bridge.domain.port.out.ClockPort;
import com.my.bridge.domain.port.out.MessageLogRepository;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 왜: 수신 메시지 하나에 대해 "무시 → 설정 → 스팸 → 연결 조회 → 필터 → 연결별 전달 → 기록" 순서를 지키고,
 * 첫 차단 조건에서 조용히 멈추도록 하기 위함.
 * 설정/스팸 조회 실패는 그대로 던져 전달을 막고(fail-closed), 연결별 전달 실패는 그 연결 안에서 끝낸다.
 */
public class RelayService implements RelayMessageUseCase {

    private static final Logger log = Logger.getLogger(RelayService.class);

    static final String EMPTY_TEXT_PLACEHOLDER = "*텍스트 없는 메시지*";

    private final ServerSettingsUseCase serverSettings;
    private final AbuseTracker abuseTracker;
    private final ConnectionRegistry connectionRegistry;
    private final ContentFilter contentFilter;
    private final ChatGatewayPort gateway;
    private final MessageLogRepository messageLog;
    private final ClockPort clockPort;
    private final BridgeLimits limits;

    public RelayService(ServerSettingsUseCase serverSettings,
                        AbuseTracker abuseTracker,
                        ConnectionRegistry connectionRegistry,
                        ContentFilter contentFilter,
                        ChatGatewayPort gateway,
                        MessageLogRepository messageLog,
                        ClockPort clockPort,
                        BridgeLimits limits) {
        this.serverSettings = serverSettings;
        this.abuseTracker = abuseTracker;
        this.connectionRegistry = connectionRegistry;
        this.contentFilter = contentFilter;
        this.gateway = gateway;
        this.messageLog = messageLog;
        this.clockPort = clockPort;
        this.limits = limits;
    }

    @Override
    public RelayResult relay(InboundMessage message) {
        if (message.authorBot()) {
            return RelayResult.stopped(RelayDecision.IGNORED_AUTOMATED);
        }
        if (!message.kind().isRelayable()) {
            return RelayResult.stopped(RelayDecision.IGNORED_KIND);
        }
        if (message.content().startsWith(limits.commandPrefix())) {
            return RelayResult.stopped(RelayDecision.IGNORED_COMMAND);
        }

        ServerSettings settings = serverSettings.get(message.guildId());
        if (settings.prefix() != null && !settings.prefix().isEmpty() && message.content().startsWith(settings.prefix())) {
            return RelayResult.stopped(RelayDecision.IGNORED_COMMAND);
        }
        if (!settings.enabled()) {
            return RelayResult.stopped(RelayDecision.DISABLED);
        }

        if (settings.spamProtection()) {
            SpamCheckResult spam = abuseTracker.recordAndCheck(message.authorId(), message.guildId(), message.channelId());
            if (spam.blocked()) {
                // 발신자에게 알리지 않는다
                log.debugf("스팸 차단 중인 사용자 메시지 무시: user=%d count=%d", message.authorId(), spam.count());
                return RelayResult.stopped(RelayDecision.SPAM_BLOCKED);
            }
        }

        List<Connection> connections = connectionRegistry.listByChannel(message.channelId());
        if (connections.isEmpty()) {
            return RelayResult.stopped(RelayDecision.NO_CONNECTIONS);
        }

        FilterVerdict verdict = contentFilter.classify(message.content(), FilterOptions.forRelay(settings.profanityFilter()));
        if (!verdict.allowed()) {
            log.infof("필터에 걸린 메시지 무시: message=%d reasons=%s", message.id(), verdict.reasons());
            return RelayResult.stopped(RelayDecision.FILTERED);
        }

        List<OutgoingFile> files = loadAttachments(message);
        String originName = resolveOriginName(message);
        int forwarded = 0;
        for (Connection connection : connections) {
            if (forward(message, connection, originName, files)) {
                forwarded++;
            }
        }
        return new RelayResult(RelayDecision.RELAYED, forwarded);
    }

    private boolean forward(InboundMessage message, Connection connection, String originName, List<OutgoingFile> files) {
        long targetChannelId = connection.oppositeChannel(message.channelId());
        try {
            Optional<ChannelInfo> target = gateway.findChannel(targetChannelId);
            if (target.isEmpty()) {
                log.warnf("대상 채널 %d에 접근할 수 없습니다 (연결 %d)", targetChannelId, connection.id());
                return false;
            }
            Set<ChannelCapability> capabilities = gateway.channelCapabilities(targetChannelId);
            if (!capabilities.contains(ChannelCapability.SEND_MESSAGES)) {
                log.warnf("대상 채널 %d에 메시지 전송 권한이 없습니다 (연결 %d)", targetChannelId, connection.id());
                return false;
            }
            if (messageLog.exists(message.id(), connection.id())) {
                log.infof("이미 전달된 메시지를 건너뜁니다: message=%d connection=%d", message.id(), connection.id());
                return false;
            }
            List<OutgoingFile> attachable = capabilities.contains(ChannelCapability.ATTACH_FILES) ? files : List.of();
            long forwardedId = gateway.send(targetChannelId, buildForward(message, connection, originName, attachable));
            messageLog.append(new MessageLogEntry(message.id(), forwardedId, message.authorId(), connection.id(),
                    clockPort.now(), contentHash(message)));
            return true;
        } catch (PermissionDeniedException e) {
            log.warnf("대상 채널 %d 전송 권한 거부 (연결 %d): %s", targetChannelId, connection.id(), e.getMessage());
        } catch (TransportException e) {
            log.errorf("대상 채널 %d 전송 실패 (연결 %d, status=%d): %s",
                    targetChannelId, connection.id(), e.statusCode(), e.getMessage());
        } catch (StorageException e) {
            log.errorf(e, "연결 %d 전달 기록 실패: message=%d", connection.id(), message.id());
        } catch (RuntimeException e) {
            log.errorf(e, "연결 %d 전달 중 예상치 못한 오류", connection.id());
        }
        return false;
    }

    private OutgoingMessage buildForward(InboundMessage message, Connection connection, String originName, List<OutgoingFile> files) {
        String description = message.hasText() ? truncate(message.content()) : EMPTY_TEXT_PLACEHOLDER;
        ForwardEmbed embed = new ForwardEmbed(
                description,
                message.authorName() + " (" + originName + ")",
                message.authorAvatarUrl(),
                message.createdAt(),
                "연결: " + connection.name() + " • ID: " + connection.id(),
                ForwardEmbed.DEFAULT_COLOR);
        return new OutgoingMessage(null, embed, files);
    }

    // 크기 초과 첨부는 알림 없이 뺀다
    private List<OutgoingFile> loadAttachments(InboundMessage message) {
        List<OutgoingFile> files = new ArrayList<>();
        for (InboundAttachment attachment : message.attachments()) {
            if (files.size() >= limits.maxAttachments()) {
                break;
            }
            if (attachment.size() > limits.maxFileSize()) {
                log.debugf("첨부 크기 초과로 제외: %s (%d bytes)", attachment.filename(), attachment.size());
                continue;
            }
            try {
                files.add(new OutgoingFile(attachment.filename(), gateway.readAttachment(attachment.url())));
            } catch (TransportException | PermissionDeniedException e) {
                log.warnf("첨부 파일을 읽지 못했습니다: %s (%s)", attachment.filename(), e.getMessage());
            }
        }
        return files;
    }

    private String resolveOriginName(InboundMessage message) {
        if (message.guildName() != null && !message.guildName().isBlank()) {
            return message.guildName();
        }
        try {
            return gateway.findChannel(message.channelId())
                    .map(ChannelInfo::guildName)
                    .filter(name -> !name.isBlank())
                    .orElse(String.valueOf(message.guildId()));
        } catch (TransportException e) {
            log.debugf("원본 서버 이름 조회 실패: %s", e.getMessage());
            return String.valueOf(message.guildId());
        }
    }

    private String truncate(String content) {
        int max = limits.maxMessageLength();
        return content.length() <= max ? content : content.substring(0, max - 3) + "...";
    }

    static String contentHash(InboundMessage message) {
        if (!message.hasText()) {
            return null;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(message.content().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256을 사용할 수 없습니다.", e);
        }
    }
}
