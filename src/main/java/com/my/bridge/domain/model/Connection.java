package com.my.bridge.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 두 서버의 채널을 잇는 양방향 중계 링크의 상태를 하나의 불변 값으로 고정하기 위함.
 */
public record Connection(long id,
                         long server1Id,
                         long channel1Id,
                         long server2Id,
                         long channel2Id,
                         String name,
                         long createdBy,
                         String description,
                         Instant createdAt,
                         boolean active) {

    public Connection {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    public boolean touchesChannel(long channelId) {
        return channel1Id == channelId || channel2Id == channelId;
    }

    public boolean touchesServer(long serverId) {
        return server1Id == serverId || server2Id == serverId;
    }

    /**
     * 원본 채널의 반대편 채널. 원본이 양쪽 어디에도 없으면 channel1을 돌려준다.
     */
    public long oppositeChannel(long sourceChannelId) {
        return channel1Id == sourceChannelId ? channel2Id : channel1Id;
    }

    public long serverOf(long channelId) {
        return channel1Id == channelId ? server1Id : server2Id;
    }
}
