package com.my.bridge.adapter.in.rabbitmq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.my.bridge.domain.exception.InvalidPayloadException;
import com.my.bridge.domain.exception.ValidationError;
import com.my.bridge.domain.exception.ValidationException;
import com.my.bridge.domain.model.Actor;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 명령 파싱 계층이 bridge-commands 채널로 보내는 요청. 인자는 이름-문자열 쌍으로 온다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommandRequest(String requestId,
                             String command,
                             long userId,
                             long guildId,
                             long channelId,
                             Long messageId,
                             boolean administrator,
                             boolean manageChannels,
                             Map<String, String> args) {

    public CommandRequest {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(command, "command");
        if (requestId.isBlank()) {
            throw new InvalidPayloadException("requestId가 비어 있습니다.");
        }
        args = args == null ? Map.of() : Map.copyOf(args);
    }

    public Actor actor() {
        return new Actor(userId, guildId, channelId, administrator, manageChannels || administrator);
    }

    public Optional<String> arg(String name) {
        return Optional.ofNullable(args.get(name)).map(String::trim).filter(value -> !value.isEmpty());
    }

    public String requireArg(String name) {
        return arg(name).orElseThrow(() -> new ValidationException(ValidationError.INVALID_ARGUMENT,
                "필수 인자가 없습니다: " + name));
    }

    public long longArg(String name) {
        String raw = requireArg(name).replaceAll("[<#>]", "");
        try {
            return Long.parseUnsignedLong(raw);
        } catch (NumberFormatException e) {
            throw new ValidationException(ValidationError.INVALID_ARGUMENT, "숫자가 아닙니다: " + name + "=" + raw);
        }
    }

    public int intArg(String name, int defaultValue) {
        Optional<String> raw = arg(name);
        if (raw.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.get());
        } catch (NumberFormatException e) {
            throw new ValidationException(ValidationError.INVALID_ARGUMENT, "숫자가 아닙니다: " + name + "=" + raw.get());
        }
    }
}
