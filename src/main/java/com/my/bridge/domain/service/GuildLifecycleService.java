package com.my.bridge.domain.service;

import com.my.bridge.domain.port.in.GuildLifecycleUseCase;
import com.my.bridge.domain.port.in.ServerSettingsUseCase;
import org.jboss.logging.Logger;

/**
 * 왜: 봇이 서버에 추가/제거될 때 설정 생성과 연결 일괄 비활성화를 도메인 규칙으로 처리하기 위함.
 */
public class GuildLifecycleService implements GuildLifecycleUseCase {

    private static final Logger log = Logger.getLogger(GuildLifecycleService.class);

    private final ServerSettingsUseCase serverSettings;
    private final ConnectionRegistry registry;

    public GuildLifecycleService(ServerSettingsUseCase serverSettings, ConnectionRegistry registry) {
        this.serverSettings = serverSettings;
        this.registry = registry;
    }

    @Override
    public void joined(long serverId) {
        serverSettings.get(serverId);
        log.infof("서버에 추가됨: %d", serverId);
    }

    @Override
    public void removed(long serverId) {
        registry.deactivateAllForServer(serverId);
        log.infof("서버에서 제거됨: %d", serverId);
    }
}
