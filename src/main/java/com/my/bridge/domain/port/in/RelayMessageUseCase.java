package com.my.bridge.domain.port.in;

import com.my.bridge.domain.model.InboundMessage;
import com.my.bridge.domain.model.RelayResult;

/**
 * 왜: 수신 메시지를 도메인 단일 진입점으로 수렴시켜 설정, 스팸, 필터, 전달 순서를 한 곳에서 통제하기 위함.
 */
public interface RelayMessageUseCase {
    RelayResult relay(InboundMessage message);
}
