package com.my.bridge.domain.model;

/**
 * 왜: 명령을 실행한 사용자와 그 사용자가 호출한 서버에서의 권한을 도메인 검증에 넘기기 위함.
 */
public record Actor(long userId, long guildId, long channelId, boolean administrator, boolean manageChannels) {
}
