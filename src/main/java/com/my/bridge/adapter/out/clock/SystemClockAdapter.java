package com.my.bridge.adapter.out.clock;

import com.my.bridge.domain.port.out.ClockPort;

import java.time.Clock;
import java.time.Instant;

/**
 * 왜: 시스템 시간을 주입형으로 제공해 테스트에서 윈도우 만료와 보존 기간을 제어하기 위함.
 */
public class SystemClockAdapter implements ClockPort {

    private final Clock clock;

    private SystemClockAdapter(Clock clock) {
        this.clock = clock;
    }

    public static SystemClockAdapter system() {
        return new SystemClockAdapter(Clock.systemUTC());
    }

    public static SystemClockAdapter of(Clock clock) {
        return new SystemClockAdapter(clock);
    }

    @Override
    public Instant now() {
        return clock.instant();
    }
}
