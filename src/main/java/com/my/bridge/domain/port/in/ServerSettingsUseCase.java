package com.my.bridge.domain.port.in;

import com.my.bridge.domain.model.ServerSettings;

public interface ServerSettingsUseCase {

    ServerSettings get(long serverId);

    ServerSettings update(long serverId, String settingName, String rawValue);
}
