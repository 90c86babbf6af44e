package com.my.bridge.domain.port.out;

import com.my.bridge.domain.model.CommandReply;

/**
 * 왜: 명령 응답 채널(RabbitMQ 등) 세부 구현을 숨기고 단일 계약으로 응답을 내보내기 위함.
 */
public interface ReplyPort {
    void send(CommandReply reply);
}
