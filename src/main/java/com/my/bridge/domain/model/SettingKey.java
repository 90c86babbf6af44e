package com.my.bridge.domain.model;

import com.my.bridge.domain.exception.ValidationError;
import com.my.bridge.domain.exception.ValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 왜: 변경 가능한 서버 설정을 닫힌 집합으로 고정해 필드 이름이 쿼리 문자열로 흘러들어가지 않도록 하기 위함.
 */
public enum SettingKey {

    PREFIX("prefix") {
        @Override
        public ServerSettings apply(ServerSettings settings, String raw) {
            String value = raw == null ? "" : raw.trim();
            if (value.isEmpty() || value.length() > 5 || value.chars().anyMatch(Character::isWhitespace)) {
                throw invalid(raw);
            }
            return settings.withPrefix(value);
        }
    },
    ENABLED("enabled") {
        @Override
        public ServerSettings apply(ServerSettings settings, String raw) {
            return settings.withEnabled(parseFlag(raw));
        }
    },
    SPAM_PROTECTION("spam_protection") {
        @Override
        public ServerSettings apply(ServerSettings settings, String raw) {
            return settings.withSpamProtection(parseFlag(raw));
        }
    },
    PROFANITY_FILTER("profanity_filter") {
        @Override
        public ServerSettings apply(ServerSettings settings, String raw) {
            return settings.withProfanityFilter(parseFlag(raw));
        }
    },
    AUTO_DELETE_COMMANDS("auto_delete_commands") {
        @Override
        public ServerSettings apply(ServerSettings settings, String raw) {
            return settings.withAutoDeleteCommands(parseFlag(raw));
        }
    },
    WEBHOOK_NOTIFICATIONS("webhook_notifications") {
        @Override
        public ServerSettings apply(ServerSettings settings, String raw) {
            return settings.withWebhookNotifications(parseFlag(raw));
        }
    },
    MOD_ROLE_ID("mod_role_id") {
        @Override
        public ServerSettings apply(ServerSettings settings, String raw) {
            return settings.withModRoleId(parseOptionalId(raw));
        }
    },
    LOG_CHANNEL_ID("log_channel_id") {
        @Override
        public ServerSettings apply(ServerSettings settings, String raw) {
            return settings.withLogChannelId(parseOptionalId(raw));
        }
    };

    private static final Set<String> TRUTHY = Set.of("true", "1", "yes", "on");
    private static final Set<String> FALSY = Set.of("false", "0", "no", "off");

    private final String externalName;

    SettingKey(String externalName) {
        this.externalName = externalName;
    }

    public String externalName() {
        return externalName;
    }

    public abstract ServerSettings apply(ServerSettings settings, String raw);

    public static Optional<SettingKey> fromExternalName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(key -> key.externalName.equals(normalized))
                .findFirst();
    }

    static boolean parseFlag(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (TRUTHY.contains(value)) {
            return true;
        }
        if (FALSY.contains(value)) {
            return false;
        }
        throw invalid(raw);
    }

    // "none"/"off"는 값을 비운다
    static Long parseOptionalId(String raw) {
        String value = raw == null ? "" : raw.trim();
        if (value.isEmpty() || "none".equalsIgnoreCase(value) || "off".equalsIgnoreCase(value)) {
            return null;
        }
        try {
            return Long.parseUnsignedLong(value.replaceAll("[<@&#>]", ""));
        } catch (NumberFormatException e) {
            throw invalid(raw);
        }
    }

    private static ValidationException invalid(String raw) {
        return new ValidationException(ValidationError.INVALID_SETTING_VALUE, "설정 값이 올바르지 않습니다: " + raw);
    }
}
