package com.my.bridge.adapter.out.discord;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.bridge.config.AppConfig;
import com.my.bridge.domain.exception.PermissionDeniedException;
import com.my.bridge.domain.exception.TransportException;
import com.my.bridge.domain.model.ChannelCapability;
import com.my.bridge.domain.model.ChannelInfo;
import com.my.bridge.domain.model.ForwardEmbed;
import com.my.bridge.domain.model.OutgoingFile;
import com.my.bridge.domain.model.OutgoingMessage;
import com.my.bridge.domain.port.out.ChatGatewayPort;
import com.my.bridge.domain.port.out.ClockPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 왜: Discord REST API 호출을 캡슐화해 도메인 게이트웨이 포트 구현을 단순화하기 위함.
 * 403은 PermissionDeniedException, 그 밖의 실패는 TransportException으로 바꾸고 재시도하지 않는다.
 * 채널/길드/봇 멤버 정보는 짧게 캐시한다.
 */
@ApplicationScoped
public class DiscordRestClient implements ChatGatewayPort {

    private static final Logger log = Logger.getLogger(DiscordRestClient.class);

    static final Duration CHANNEL_TTL = Duration.ofMinutes(1);
    static final Duration GUILD_TTL = Duration.ofMinutes(5);
    private static final String USER_AGENT = "DiscordBot (https://github.com/my/guild-bridge, 1.0)";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ClockPort clockPort;
    private final String apiBase;
    private final Optional<String> botToken;
    private final Duration requestTimeout;

    private final Map<Long, Cached<ChannelDto>> channels = new ConcurrentHashMap<>();
    private final Map<Long, Cached<GuildDto>> guilds = new ConcurrentHashMap<>();
    private final Map<Long, Cached<List<Long>>> botRoles = new ConcurrentHashMap<>();
    private volatile Long botUserId;

    @Inject
    public DiscordRestClient(AppConfig appConfig, ObjectMapper objectMapper, ClockPort clockPort) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(),
                objectMapper,
                clockPort,
                appConfig.discord().apiBase(),
                appConfig.discord().botToken().filter(token -> !token.isBlank()),
                Duration.ofSeconds(appConfig.discord().requestTimeoutSeconds()));
    }

    DiscordRestClient(HttpClient httpClient,
                      ObjectMapper objectMapper,
                      ClockPort clockPort,
                      String apiBase,
                      Optional<String> botToken,
                      Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.clockPort = clockPort;
        this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
        this.botToken = botToken;
        this.requestTimeout = requestTimeout;
    }

    public boolean configured() {
        return botToken.isPresent();
    }

    @Override
    public long send(long channelId, OutgoingMessage message) {
        CreateMessageRequest payload = toRequest(message);
        HttpRequest.Builder builder = api("/channels/" + channelId + "/messages");
        if (message.files().isEmpty()) {
            builder.header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(write(payload)));
        } else {
            MultipartBody body = new MultipartBody().json("payload_json", write(payload));
            for (int i = 0; i < message.files().size(); i++) {
                OutgoingFile file = message.files().get(i);
                body.file("files[" + i + "]", file.filename(), file.data());
            }
            builder.header("Content-Type", body.contentType())
                    .POST(HttpRequest.BodyPublishers.ofByteArray(body.build()));
        }
        HttpResponse<String> response = call(builder.build());
        ensureSuccess(response, "메시지 전송");
        return Long.parseLong(read(response.body(), IdDto.class).id());
    }

    @Override
    public Set<ChannelCapability> channelCapabilities(long channelId) {
        Optional<ChannelDto> channel = channel(channelId);
        if (channel.isEmpty() || channel.get().guildId() == null) {
            return Set.of();
        }
        long guildId = Long.parseLong(channel.get().guildId());
        GuildDto guild = guild(guildId);
        long self = botUserId();
        Map<Long, Long> rolePermissions = Optional.ofNullable(guild.roles()).orElse(List.of()).stream()
                .collect(Collectors.toMap(role -> Long.parseLong(role.id()), role -> parseBits(role.permissions()), (a, b) -> a));
        List<PermissionCalculator.Overwrite> overwrites = Optional.ofNullable(channel.get().overwrites()).orElse(List.of())
                .stream()
                .map(o -> new PermissionCalculator.Overwrite(Long.parseLong(o.id()), o.type(), parseBits(o.allow()), parseBits(o.deny())))
                .toList();
        long permissions = PermissionCalculator.compute(guildId, parseBits(guild.ownerId()), self,
                botRoles(guildId, self), rolePermissions, overwrites);
        return PermissionCalculator.toCapabilities(permissions);
    }

    @Override
    public Optional<ChannelInfo> findChannel(long channelId) {
        return channel(channelId)
                .filter(channel -> channel.guildId() != null)
                .map(channel -> {
                    long guildId = Long.parseLong(channel.guildId());
                    return new ChannelInfo(channelId, guildId, channel.name(), guild(guildId).name());
                });
    }

    @Override
    public byte[] readAttachment(String url) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("User-Agent", USER_AGENT)
                    .timeout(requestTimeout)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new TransportException("첨부 URL이 올바르지 않습니다: " + url, e);
        }
        try {
            HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            ensureSuccess(response, "첨부 다운로드");
            return response.body();
        } catch (IOException e) {
            throw new TransportException("첨부 다운로드 실패: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("첨부 다운로드 중단", e);
        }
    }

    @Override
    public void deleteMessage(long channelId, long messageId) {
        HttpResponse<String> response = call(api("/channels/" + channelId + "/messages/" + messageId).DELETE().build());
        if (response.statusCode() == 404) {
            log.debugf("이미 삭제된 메시지: channel=%d message=%d", channelId, messageId);
            return;
        }
        ensureSuccess(response, "메시지 삭제");
    }

    private Optional<ChannelDto> channel(long channelId) {
        Cached<ChannelDto> cached = channels.get(channelId);
        Instant now = clockPort.now();
        if (cached != null && cached.isFresh(now)) {
            return Optional.of(cached.value());
        }
        HttpResponse<String> response = call(api("/channels/" + channelId).GET().build());
        // 봇이 볼 수 없는 채널은 도달 불가로 본다
        if (response.statusCode() == 404 || response.statusCode() == 403) {
            channels.remove(channelId);
            return Optional.empty();
        }
        ensureSuccess(response, "채널 조회");
        ChannelDto channel = read(response.body(), ChannelDto.class);
        evictExpired(channels, now);
        channels.put(channelId, new Cached<>(channel, now.plus(CHANNEL_TTL)));
        return Optional.of(channel);
    }

    private GuildDto guild(long guildId) {
        return cachedLookup(guilds, guildId, GUILD_TTL, id -> {
            HttpResponse<String> response = call(api("/guilds/" + id).GET().build());
            ensureSuccess(response, "서버 조회");
            return read(response.body(), GuildDto.class);
        });
    }

    private List<Long> botRoles(long guildId, long self) {
        return cachedLookup(botRoles, guildId, GUILD_TTL, id -> {
            HttpResponse<String> response = call(api("/guilds/" + id + "/members/" + self).GET().build());
            ensureSuccess(response, "봇 멤버 조회");
            return Optional.ofNullable(read(response.body(), MemberDto.class).roles()).orElse(List.of()).stream()
                    .map(Long::parseLong)
                    .toList();
        });
    }

    private long botUserId() {
        Long cached = botUserId;
        if (cached != null) {
            return cached;
        }
        HttpResponse<String> response = call(api("/users/@me").GET().build());
        ensureSuccess(response, "봇 사용자 조회");
        long id = Long.parseLong(read(response.body(), IdDto.class).id());
        botUserId = id;
        return id;
    }

    private <T> T cachedLookup(Map<Long, Cached<T>> cache, long key, Duration ttl, Function<Long, T> loader) {
        Instant now = clockPort.now();
        Cached<T> cached = cache.get(key);
        if (cached != null && cached.isFresh(now)) {
            return cached.value();
        }
        T value = loader.apply(key);
        evictExpired(cache, now);
        cache.put(key, new Cached<>(value, now.plus(ttl)));
        return value;
    }

    // 만료된 항목은 새 항목을 넣을 때 비운다
    private static <T> void evictExpired(Map<Long, Cached<T>> cache, Instant now) {
        cache.values().removeIf(entry -> !entry.isFresh(now));
    }

    int cachedEntries() {
        return channels.size() + guilds.size() + botRoles.size();
    }

    private HttpRequest.Builder api(String path) {
        String token = botToken.orElseThrow(() -> new TransportException("Discord 봇 토큰이 설정되지 않았습니다."));
        return HttpRequest.newBuilder()
                .uri(URI.create(apiBase + path))
                .header("Authorization", "Bot " + token)
                .header("User-Agent", USER_AGENT)
                .timeout(requestTimeout);
    }

    private HttpResponse<String> call(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransportException("Discord API 호출 실패: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Discord API 호출 중단", e);
        }
    }

    private static void ensureSuccess(HttpResponse<?> response, String action) {
        int status = response.statusCode();
        if (status == 403) {
            throw new PermissionDeniedException(action + " 권한이 없습니다.");
        }
        if (status >= 400) {
            throw new TransportException(action + " 실패 status=" + status, status, null);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new TransportException("요청 직렬화 실패", e);
        }
    }

    private <T> T read(String body, Class<T> type) {
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new TransportException("응답 파싱 실패: " + e.getOriginalMessage(), e);
        }
    }

    private static long parseBits(String value) {
        return value == null || value.isBlank() ? 0L : Long.parseLong(value);
    }

    static CreateMessageRequest toRequest(OutgoingMessage message) {
        List<EmbedDto> embeds = null;
        ForwardEmbed embed = message.embed();
        if (embed != null) {
            embeds = List.of(new EmbedDto(
                    embed.description(),
                    embed.color(),
                    embed.timestamp() == null ? null : embed.timestamp().toString(),
                    new AuthorDto(embed.authorName(), embed.authorIconUrl()),
                    embed.footer() == null ? null : new FooterDto(embed.footer())));
        }
        List<AttachmentRef> attachments = null;
        if (!message.files().isEmpty()) {
            attachments = new ArrayList<>();
            for (int i = 0; i < message.files().size(); i++) {
                attachments.add(new AttachmentRef(i, message.files().get(i).filename()));
            }
        }
        return new CreateMessageRequest(message.text(), embeds, attachments);
    }

    private record Cached<T>(T value, Instant expiresAt) {
        boolean isFresh(Instant now) {
            return now.isBefore(expiresAt);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record CreateMessageRequest(@JsonProperty("content") String content,
                                @JsonProperty("embeds") List<EmbedDto> embeds,
                                @JsonProperty("attachments") List<AttachmentRef> attachments) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record EmbedDto(@JsonProperty("description") String description,
                    @JsonProperty("color") int color,
                    @JsonProperty("timestamp") String timestamp,
                    @JsonProperty("author") AuthorDto author,
                    @JsonProperty("footer") FooterDto footer) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record AuthorDto(@JsonProperty("name") String name,
                     @JsonProperty("icon_url") String iconUrl) {
    }

    record FooterDto(@JsonProperty("text") String text) {
    }

    record AttachmentRef(@JsonProperty("id") int id,
                         @JsonProperty("filename") String filename) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record IdDto(@JsonProperty("id") String id) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ChannelDto(@JsonProperty("id") String id,
                              @JsonProperty("guild_id") String guildId,
                              @JsonProperty("name") String name,
                              @JsonProperty("permission_overwrites") List<OverwriteDto> overwrites) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record OverwriteDto(@JsonProperty("id") String id,
                                @JsonProperty("type") int type,
                                @JsonProperty("allow") String allow,
                                @JsonProperty("deny") String deny) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record GuildDto(@JsonProperty("id") String id,
                            @JsonProperty("name") String name,
                            @JsonProperty("owner_id") String ownerId,
                            @JsonProperty("roles") List<RoleDto> roles) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record RoleDto(@JsonProperty("id") String id,
                           @JsonProperty("permissions") String permissions) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record MemberDto(@JsonProperty("roles") List<String> roles) {
    }
}
