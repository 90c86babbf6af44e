package com.my.bridge.domain.port.out;

import com.my.bridge.domain.model.ChannelCapability;
import com.my.bridge.domain.model.ChannelInfo;
import com.my.bridge.domain.model.OutgoingMessage;

import java.util.Optional;
import java.util.Set;

/**
 * 왜: 채팅 플랫폼 API 호출을 추상화해 중계 로직이 HTTP/게이트웨이 세부 구현에 묶이지 않도록 하기 위함.
 * 실패는 {@link com.my.bridge.domain.exception.PermissionDeniedException} 또는
 * {@link com.my.bridge.domain.exception.TransportException}으로 올라온다.
 */
public interface ChatGatewayPort {

    long send(long channelId, OutgoingMessage message);

    Set<ChannelCapability> channelCapabilities(long channelId);

    Optional<ChannelInfo> findChannel(long channelId);

    byte[] readAttachment(String url);

    void deleteMessage(long channelId, long messageId);
}
