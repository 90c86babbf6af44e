package com.my.bridge.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 서버별 중계/모더레이션 설정을 타입이 있는 불변 값으로 다루고, 변경은 with 메서드로만 허용하기 위함.
 */
public record ServerSettings(long serverId,
                             String prefix,
                             boolean enabled,
                             Long modRoleId,
                             Long logChannelId,
                             boolean spamProtection,
                             boolean profanityFilter,
                             boolean autoDeleteCommands,
                             boolean webhookNotifications,
                             Instant createdAt,
                             Instant updatedAt) {

    public ServerSettings {
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
    }

    public static ServerSettings defaults(long serverId, Instant now) {
        return new ServerSettings(serverId, null, true, null, null, true, true, false, false, now, now);
    }

    public ServerSettings withPrefix(String value) {
        return new ServerSettings(serverId, value, enabled, modRoleId, logChannelId, spamProtection,
                profanityFilter, autoDeleteCommands, webhookNotifications, createdAt, updatedAt);
    }

    public ServerSettings withEnabled(boolean value) {
        return new ServerSettings(serverId, prefix, value, modRoleId, logChannelId, spamProtection,
                profanityFilter, autoDeleteCommands, webhookNotifications, createdAt, updatedAt);
    }

    public ServerSettings withModRoleId(Long value) {
        return new ServerSettings(serverId, prefix, enabled, value, logChannelId, spamProtection,
                profanityFilter, autoDeleteCommands, webhookNotifications, createdAt, updatedAt);
    }

    public ServerSettings withLogChannelId(Long value) {
        return new ServerSettings(serverId, prefix, enabled, modRoleId, value, spamProtection,
                profanityFilter, autoDeleteCommands, webhookNotifications, createdAt, updatedAt);
    }

    public ServerSettings withSpamProtection(boolean value) {
        return new ServerSettings(serverId, prefix, enabled, modRoleId, logChannelId, value,
                profanityFilter, autoDeleteCommands, webhookNotifications, createdAt, updatedAt);
    }

    public ServerSettings withProfanityFilter(boolean value) {
        return new ServerSettings(serverId, prefix, enabled, modRoleId, logChannelId, spamProtection,
                value, autoDeleteCommands, webhookNotifications, createdAt, updatedAt);
    }

    public ServerSettings withAutoDeleteCommands(boolean value) {
        return new ServerSettings(serverId, prefix, enabled, modRoleId, logChannelId, spamProtection,
                profanityFilter, value, webhookNotifications, createdAt, updatedAt);
    }

    public ServerSettings withWebhookNotifications(boolean value) {
        return new ServerSettings(serverId, prefix, enabled, modRoleId, logChannelId, spamProtection,
                profanityFilter, autoDeleteCommands, value, createdAt, updatedAt);
    }

    public ServerSettings touchedAt(Instant now) {
        return new ServerSettings(serverId, prefix, enabled, modRoleId, logChannelId, spamProtection,
                profanityFilter, autoDeleteCommands, webhookNotifications, createdAt, now);
    }
}
