package com.my.bridge.domain.model;

public record ChannelInfo(long id, long guildId, String name, String guildName) {
}
