package com.my.bridge.support;

import com.my.bridge.domain.exception.TransportException;
import com.my.bridge.domain.model.ChannelCapability;
import com.my.bridge.domain.model.ChannelInfo;
import com.my.bridge.domain.model.OutgoingMessage;
import com.my.bridge.domain.port.out.ChatGatewayPort;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 채널/권한/첨부를 미리 심어 두고 보낸 메시지를 기록하는 게이트웨이 대역.
 */
public class RecordingGateway implements ChatGatewayPort {

    public record Sent(long channelId, OutgoingMessage message, long id) {
    }

    private final Map<Long, ChannelInfo> channels = new ConcurrentHashMap<>();
    private final Map<Long, Set<ChannelCapability>> capabilities = new ConcurrentHashMap<>();
    private final Map<String, byte[]> attachments = new ConcurrentHashMap<>();
    private final Set<Long> failingChannels = ConcurrentHashMap.newKeySet();
    private final List<Sent> sent = new CopyOnWriteArrayList<>();
    private final List<Long> deleted = new CopyOnWriteArrayList<>();
    private final AtomicLong ids = new AtomicLong(9000);

    public RecordingGateway channel(long channelId, long guildId, String guildName) {
        channels.put(channelId, new ChannelInfo(channelId, guildId, "channel-" + channelId, guildName));
        capabilities.putIfAbsent(channelId, EnumSet.allOf(ChannelCapability.class));
        return this;
    }

    public RecordingGateway capabilities(long channelId, Set<ChannelCapability> granted) {
        capabilities.put(channelId, granted.isEmpty() ? EnumSet.noneOf(ChannelCapability.class) : EnumSet.copyOf(granted));
        return this;
    }

    public RecordingGateway attachment(String url, byte[] data) {
        attachments.put(url, data);
        return this;
    }

    public RecordingGateway failOn(long channelId) {
        failingChannels.add(channelId);
        return this;
    }

    public List<Sent> sent() {
        return List.copyOf(sent);
    }

    public List<Sent> sentTo(long channelId) {
        return sent.stream().filter(s -> s.channelId() == channelId).toList();
    }

    public List<Long> deleted() {
        return List.copyOf(deleted);
    }

    @Override
    public long send(long channelId, OutgoingMessage message) {
        if (failingChannels.contains(channelId)) {
            throw new TransportException("전송 실패", 500, null);
        }
        long id = ids.incrementAndGet();
        sent.add(new Sent(channelId, message, id));
        return id;
    }

    @Override
    public Set<ChannelCapability> channelCapabilities(long channelId) {
        return capabilities.getOrDefault(channelId, Set.of());
    }

    @Override
    public Optional<ChannelInfo> findChannel(long channelId) {
        return Optional.ofNullable(channels.get(channelId));
    }

    @Override
    public byte[] readAttachment(String url) {
        byte[] data = attachments.get(url);
        if (data == null) {
            throw new TransportException("첨부 없음: " + url, 404, null);
        }
        return data;
    }

    @Override
    public void deleteMessage(long channelId, long messageId) {
        deleted.add(messageId);
    }
}
