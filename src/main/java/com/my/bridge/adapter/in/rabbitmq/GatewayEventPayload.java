package com.my.bridge.adapter.in.rabbitmq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.my.bridge.domain.exception.InvalidPayloadException;
import com.my.bridge.domain.model.InboundAttachment;
import com.my.bridge.domain.model.InboundMessage;
import com.my.bridge.domain.model.MessageKind;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 게이트웨이 프로세스가 gateway-events 채널로 보내는 이벤트 봉투.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayEventPayload(String eventId,
                                  String type,
                                  Long guildId,
                                  String guildName,
                                  MessagePayload message) {

    public enum EventType {
        MESSAGE_CREATE,
        MESSAGE_UPDATE,
        GUILD_CREATE,
        GUILD_DELETE
    }

    public GatewayEventPayload {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(type, "type");
        if (eventId.isBlank()) {
            throw new InvalidPayloadException("eventId가 비어 있습니다.");
        }
    }

    public EventType eventType() {
        try {
            return EventType.valueOf(type);
        } catch (IllegalArgumentException e) {
            throw new InvalidPayloadException("알 수 없는 이벤트 유형: " + type, e);
        }
    }

    public long requireGuildId() {
        return Optional.ofNullable(message).map(MessagePayload::guildId)
                .or(() -> Optional.ofNullable(guildId))
                .orElseThrow(() -> new InvalidPayloadException("guildId가 없습니다."));
    }

    // DM 등 서버 밖 메시지는 중계 대상이 아니다
    public boolean isGuildMessage() {
        return message != null && (message.guildId() != null || guildId != null);
    }

    public InboundMessage toInboundMessage() {
        if (message == null) {
            throw new InvalidPayloadException("message가 없습니다.");
        }
        MessageKind kind = eventType() == EventType.MESSAGE_UPDATE
                ? MessageKind.EDIT
                : MessageKind.fromCode(Optional.ofNullable(message.type()).orElse(0));
        List<InboundAttachment> attachments = Optional.ofNullable(message.attachments()).orElse(List.of()).stream()
                .map(attachment -> new InboundAttachment(attachment.url(), attachment.size(), attachment.filename()))
                .toList();
        return new InboundMessage(
                message.id(),
                message.authorId(),
                message.authorBot(),
                message.authorName(),
                message.authorAvatarUrl(),
                message.content(),
                attachments,
                message.channelId(),
                requireGuildId(),
                guildName,
                parseTimestamp(message.createdAt()),
                kind);
    }

    private static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidPayloadException("createdAt이 없습니다.");
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            throw new InvalidPayloadException("createdAt 형식이 올바르지 않습니다: " + value, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagePayload(long id,
                                 long authorId,
                                 boolean authorBot,
                                 String authorName,
                                 String authorAvatarUrl,
                                 String content,
                                 List<AttachmentPayload> attachments,
                                 long channelId,
                                 Long guildId,
                                 String createdAt,
                                 Integer type) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AttachmentPayload(String url, long size, String filename) {
        public AttachmentPayload {
            Objects.requireNonNull(url, "url");
            filename = filename == null || filename.isBlank() ? "attachment" : filename;
        }
    }
}
