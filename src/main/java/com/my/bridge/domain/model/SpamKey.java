package com.my.bridge.domain.model;

/**
 * 왜: 스팸 카운터의 식별 단위(사용자, 서버, 채널)를 하나의 값으로 묶어 잠금/조회 키로 쓰기 위함.
 */
public record SpamKey(long userId, long serverId, long channelId) {
}
