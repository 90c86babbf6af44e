package com.my.bridge.domain.port.out;

import com.my.bridge.domain.model.Connection;
import com.my.bridge.domain.model.NewConnection;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 왜: 연결 행의 저장 방식을 숨겨 레지스트리가 조회/소프트 삭제 계약에만 의존하도록 하기 위함.
 * 조회 메서드는 모두 활성 행만 돌려준다.
 */
public interface ConnectionRepository {

    long insert(NewConnection connection, Instant createdAt);

    Optional<Connection> findActiveById(long id);

    List<Connection> listActiveByChannel(long channelId);

    List<Connection> listActiveByServer(long serverId);

    boolean existsActivePair(long channelA, long channelB);

    int countActiveForServer(long serverId);

    long countActive();

    boolean deactivate(long id);

    int deactivateAllForServer(long serverId);
}
