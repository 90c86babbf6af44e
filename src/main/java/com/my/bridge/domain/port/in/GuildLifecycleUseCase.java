package com.my.bridge.domain.port.in;

public interface GuildLifecycleUseCase {

    void joined(long serverId);

    void removed(long serverId);
}
