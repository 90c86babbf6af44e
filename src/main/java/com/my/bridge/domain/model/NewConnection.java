package com.my.bridge.domain.model;

import java.util.Objects;

/**
 * 왜: 아직 ID가 부여되지 않은 생성 요청을 저장된 Connection과 구분하기 위함.
 */
public record NewConnection(long server1Id,
                            long channel1Id,
                            long server2Id,
                            long channel2Id,
                            String name,
                            long createdBy,
                            String description) {

    public NewConnection {
        Objects.requireNonNull(name, "name");
    }
}
