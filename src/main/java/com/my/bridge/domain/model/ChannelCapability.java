package com.my.bridge.domain.model;

/**
 * 왜: 봇이 채널에서 가진 권한 중 중계/연결 관리에 필요한 것만 도메인 용어로 표현하기 위함.
 */
public enum ChannelCapability {
    VIEW_CHANNEL,
    SEND_MESSAGES,
    EMBED_LINKS,
    ATTACH_FILES,
    READ_MESSAGE_HISTORY
}
