package com.my.bridge.domain.service;

import com.my.bridge.domain.model.SpamCheckResult;
import com.my.bridge.domain.model.SpamKey;
import com.my.bridge.domain.model.SpamTrackingEntry;
import com.my.bridge.domain.port.out.ClockPort;
import com.my.bridge.domain.port.out.SpamTrackingRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 왜: (사용자, 서버, 채널)마다 슬라이딩 윈도우 카운터를 유지해 차단 여부를 결정하기 위함.
 * 같은 키의 읽기-수정-쓰기는 키 단위 잠금으로 직렬화하고, 다른 키끼리는 서로 기다리지 않는다.
 */
public class AbuseTracker {

    private final SpamTrackingRepository repository;
    private final ClockPort clockPort;
    private final int threshold;
    private final Duration window;
    private final Map<SpamKey, KeyLock> locks = new ConcurrentHashMap<>();

    public AbuseTracker(SpamTrackingRepository repository, ClockPort clockPort, int threshold, Duration window) {
        this.repository = repository;
        this.clockPort = clockPort;
        this.threshold = threshold;
        this.window = window;
    }

    public SpamCheckResult recordAndCheck(long userId, long serverId, long channelId) {
        SpamKey key = new SpamKey(userId, serverId, channelId);
        KeyLock lock = acquire(key);
        try {
            Instant now = clockPort.now();
            SpamTrackingEntry next = repository.find(key)
                    .filter(entry -> entry.isLive(now, window))
                    .map(entry -> entry.increment(now, threshold))
                    .orElseGet(() -> SpamTrackingEntry.first(key, now));
            repository.save(next);
            return new SpamCheckResult(next.messageCount(), next.blocked());
        } finally {
            release(key, lock);
        }
    }

    private KeyLock acquire(SpamKey key) {
        KeyLock lock = locks.compute(key, (k, existing) -> {
            KeyLock target = existing == null ? new KeyLock() : existing;
            target.holders++;
            return target;
        });
        lock.lock();
        return lock;
    }

    // 마지막 사용자가 빠지면 맵에서 지워 키가 무한히 쌓이지 않게 한다.
    private void release(SpamKey key, KeyLock lock) {
        lock.unlock();
        locks.computeIfPresent(key, (k, existing) -> --existing.holders == 0 ? null : existing);
    }

    int trackedLocks() {
        return locks.size();
    }

    private static final class KeyLock extends ReentrantLock {
        // compute 람다 안에서만 읽고 쓴다
        private int holders;
    }
}
