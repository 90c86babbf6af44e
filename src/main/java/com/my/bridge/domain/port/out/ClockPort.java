package com.my.bridge.domain.port.out;

import java.time.Instant;

/**
 * 왜: 현재 시각을 주입형으로 분리해 윈도우 만료/보존 기간 로직을 테스트에서 제어하기 위함.
 */
public interface ClockPort {
    Instant now();
}
