package com.my.bridge.domain.service;

import com.my.bridge.domain.exception.StorageException;
import com.my.bridge.domain.exception.ValidationError;
import com.my.bridge.domain.exception.ValidationException;
import com.my.bridge.domain.model.ServerSettings;
import com.my.bridge.domain.model.SettingKey;
import com.my.bridge.domain.port.in.ServerSettingsUseCase;
import com.my.bridge.domain.port.out.ClockPort;
import com.my.bridge.domain.port.out.ServerSettingsRepository;
import org.jboss.logging.Logger;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * 왜: 서버 설정을 처음 접근할 때 기본값으로 만들고, 변경은 닫힌 키 집합을 거쳐서만 반영하기 위함.
 */
public class ServerSettingsService implements ServerSettingsUseCase {

    private static final Logger log = Logger.getLogger(ServerSettingsService.class);

    private final ServerSettingsRepository repository;
    private final ClockPort clockPort;

    public ServerSettingsService(ServerSettingsRepository repository, ClockPort clockPort) {
        this.repository = repository;
        this.clockPort = clockPort;
    }

    @Override
    public ServerSettings get(long serverId) {
        return repository.find(serverId).orElseGet(() -> {
            repository.insertIfAbsent(ServerSettings.defaults(serverId, clockPort.now()));
            log.debugf("서버 %d 기본 설정 생성", serverId);
            return repository.find(serverId)
                    .orElseThrow(() -> new StorageException("서버 설정 생성 직후 조회 실패: " + serverId, null));
        });
    }

    @Override
    public ServerSettings update(long serverId, String settingName, String rawValue) {
        SettingKey key = SettingKey.fromExternalName(settingName)
                .orElseThrow(() -> new ValidationException(ValidationError.UNKNOWN_SETTING,
                        "알 수 없는 설정입니다. 사용 가능: " + Arrays.stream(SettingKey.values())
                                .map(SettingKey::externalName)
                                .collect(Collectors.joining(", "))));
        ServerSettings updated = key.apply(get(serverId), rawValue).touchedAt(clockPort.now());
        repository.update(updated);
        log.infof("서버 %d 설정 변경: %s=%s", serverId, key.externalName(), rawValue);
        return updated;
    }
}
