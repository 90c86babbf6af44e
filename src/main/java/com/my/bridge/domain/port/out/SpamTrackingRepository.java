package com.my.bridge.domain.port.out;

import com.my.bridge.domain.model.SpamKey;
import com.my.bridge.domain.model.SpamTrackingEntry;

import java.time.Instant;
import java.util.Optional;

/**
 * 왜: 스팸 카운터 저장소를 교체 가능하게(SQLite/메모리) 두고, 만료 판단은 도메인에 남기기 위함.
 * 만료 여부와 상관없이 키에 해당하는 마지막 행을 돌려준다.
 */
public interface SpamTrackingRepository {

    Optional<SpamTrackingEntry> find(SpamKey key);

    void save(SpamTrackingEntry entry);

    int deleteLastSeenBefore(Instant cutoff);
}
