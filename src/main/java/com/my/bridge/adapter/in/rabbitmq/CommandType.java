package com.my.bridge.adapter.in.rabbitmq;

import com.my.bridge.domain.model.Actor;

import java.util.Locale;
import java.util.Optional;

/**
 * 왜: 명령마다 실행자에게 요구하는 서버 권한(관리자/채널 관리)을 명령 정의와 함께 고정하기 위함.
 */
public enum CommandType {
    CONNECT_CREATE(Requirement.MANAGE_CHANNELS),
    CONNECT_LIST(Requirement.NONE),
    CONNECT_INFO(Requirement.NONE),
    CONNECT_REMOVE(Requirement.MANAGE_CHANNELS),
    CONNECT_TEST(Requirement.ADMINISTRATOR),
    SETTINGS_SHOW(Requirement.ADMINISTRATOR),
    SETTINGS_SET(Requirement.ADMINISTRATOR),
    STATS(Requirement.ADMINISTRATOR),
    SERVER_STATS(Requirement.ADMINISTRATOR),
    CLEANUP(Requirement.ADMINISTRATOR),
    CONFIRM(Requirement.NONE);

    enum Requirement {
        NONE,
        MANAGE_CHANNELS,
        ADMINISTRATOR
    }

    private final Requirement requirement;

    CommandType(Requirement requirement) {
        this.requirement = requirement;
    }

    public boolean permits(Actor actor) {
        return switch (requirement) {
            case NONE -> true;
            case MANAGE_CHANNELS -> actor.manageChannels() || actor.administrator();
            case ADMINISTRATOR -> actor.administrator();
        };
    }

    public static Optional<CommandType> parse(String raw) {
        try {
            return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_')));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
