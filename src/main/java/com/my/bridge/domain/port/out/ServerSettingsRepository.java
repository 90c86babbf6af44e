package com.my.bridge.domain.port.out;

import com.my.bridge.domain.model.ServerSettings;

import java.util.Optional;

public interface ServerSettingsRepository {

    Optional<ServerSettings> find(long serverId);

    /**
     * 이미 행이 있으면 아무것도 하지 않는다.
     */
    void insertIfAbsent(ServerSettings defaults);

    void update(ServerSettings settings);

    long count();
}
