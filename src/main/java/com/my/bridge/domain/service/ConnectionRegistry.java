package com.my.bridge.domain.service;

import com.my.bridge.domain.exception.NotFoundException;
import com.my.bridge.domain.exception.ValidationError;
import com.my.bridge.domain.exception.ValidationException;
import com.my.bridge.domain.model.Connection;
import com.my.bridge.domain.model.NewConnection;
import com.my.bridge.domain.port.out.ClockPort;
import com.my.bridge.domain.port.out.ConnectionRepository;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 왜: 연결 생성 규칙(다른 서버끼리만, 서버당 한도, 정확히 같은 채널 쌍 중복 금지)과 소프트 삭제를 한 곳에서 지키기 위함.
 */
public class ConnectionRegistry {

    private static final Logger log = Logger.getLogger(ConnectionRegistry.class);

    private final ConnectionRepository repository;
    private final ClockPort clockPort;
    private final int maxConnectionsPerServer;
    // 검사와 삽입 사이에 다른 생성이 끼어들면 한도가 깨진다
    private final ReentrantLock createLock = new ReentrantLock();

    public ConnectionRegistry(ConnectionRepository repository, ClockPort clockPort, int maxConnectionsPerServer) {
        this.repository = repository;
        this.clockPort = clockPort;
        this.maxConnectionsPerServer = maxConnectionsPerServer;
    }

    public long create(long server1Id,
                       long channel1Id,
                       long server2Id,
                       long channel2Id,
                       String name,
                       long createdBy,
                       String description) {
        if (server1Id == server2Id) {
            throw new ValidationException(ValidationError.SAME_SERVER, "같은 서버의 채널끼리는 연결할 수 없습니다.");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException(ValidationError.INVALID_ARGUMENT, "연결 이름이 비어 있습니다.");
        }
        createLock.lock();
        try {
            checkQuota(server1Id);
            checkQuota(server2Id);
            if (repository.existsActivePair(channel1Id, channel2Id)) {
                throw new ValidationException(ValidationError.DUPLICATE_CONNECTION,
                        "두 채널 사이에 이미 활성 연결이 있습니다.");
            }
            long id = repository.insert(
                    new NewConnection(server1Id, channel1Id, server2Id, channel2Id, name.trim(), createdBy, description),
                    clockPort.now());
            log.infof("연결 생성: id=%d %d#%d <-> %d#%d", id, server1Id, channel1Id, server2Id, channel2Id);
            return id;
        } finally {
            createLock.unlock();
        }
    }

    public Connection getById(long id) {
        return repository.findActiveById(id)
                .orElseThrow(() -> new NotFoundException("연결을 찾을 수 없습니다: " + id));
    }

    public List<Connection> listByChannel(long channelId) {
        return repository.listActiveByChannel(channelId);
    }

    public List<Connection> listByServer(long serverId) {
        return repository.listActiveByServer(serverId);
    }

    public boolean softDelete(long id) {
        boolean changed = repository.deactivate(id);
        if (changed) {
            log.infof("연결 비활성화: id=%d", id);
        }
        return changed;
    }

    public int countActiveForServer(long serverId) {
        return repository.countActiveForServer(serverId);
    }

    public int deactivateAllForServer(long serverId) {
        int count = repository.deactivateAllForServer(serverId);
        log.infof("서버 %d의 연결 %d건 비활성화", serverId, count);
        return count;
    }

    public int maxConnectionsPerServer() {
        return maxConnectionsPerServer;
    }

    private void checkQuota(long serverId) {
        int current = repository.countActiveForServer(serverId);
        if (current >= maxConnectionsPerServer) {
            throw new ValidationException(ValidationError.QUOTA_EXCEEDED,
                    "서버 " + serverId + "의 연결 한도(" + maxConnectionsPerServer + ")를 초과했습니다.");
        }
    }
}
