package com.my.bridge.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.bridge.adapter.in.idempotency.IdempotencyStore;
import com.my.bridge.domain.exception.InvalidPayloadException;
import com.my.bridge.domain.exception.StorageException;
import com.my.bridge.domain.model.InboundMessage;
import com.my.bridge.domain.model.RelayResult;
import com.my.bridge.domain.port.in.GuildLifecycleUseCase;
import com.my.bridge.domain.port.in.RelayMessageUseCase;
import io.smallrye.mutiny.Uni;
import io.smallrye.reactive.messaging.annotations.Blocking;
import io.smallrye.reactive.messaging.rabbitmq.IncomingRabbitMQMetadata;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.io.IOException;
import java.util.Optional;

/**
 * 왜: 게이트웨이 이벤트를 도메인 유스케이스로 진입시키는 단일 경로이자 프로세스 전역 오류 경계.
 * 이벤트마다 워커 스레드 하나에서 독립적으로 처리하고, 어떤 실패든 로그만 남기고 ack한다.
 */
@ApplicationScoped
public class GatewayEventConsumer {

    private static final Logger log = Logger.getLogger(GatewayEventConsumer.class);

    private final RelayMessageUseCase relayMessageUseCase;
    private final GuildLifecycleUseCase guildLifecycleUseCase;
    private final IdempotencyStore idempotencyStore;
    private final ObjectMapper objectMapper;

    @Inject
    public GatewayEventConsumer(RelayMessageUseCase relayMessageUseCase,
                                GuildLifecycleUseCase guildLifecycleUseCase,
                                IdempotencyStore idempotencyStore,
                                ObjectMapper objectMapper) {
        this.relayMessageUseCase = relayMessageUseCase;
        this.guildLifecycleUseCase = guildLifecycleUseCase;
        this.idempotencyStore = idempotencyStore;
        this.objectMapper = objectMapper;
    }

    @Incoming("gateway-events")
    @Blocking(ordered = false)
    public Uni<Void> consume(Message<String> message) {
        return Uni.createFrom().item(() -> {
            handle(message.getPayload(), resolveCorrelationId(message));
            return null;
        }).replaceWithVoid().chain(() -> Uni.createFrom().completionStage(message.ack()));
    }

    void handle(String payload, Optional<String> correlationId) {
        GatewayEventPayload event;
        try {
            event = objectMapper.readValue(payload, GatewayEventPayload.class);
        } catch (IOException | InvalidPayloadException e) {
            log.warnf("게이트웨이 이벤트 파싱 실패로 처리 중단: %s", e.getMessage());
            return;
        }
        MDC.put("correlationId", correlationId.orElse(event.eventId()));
        MDC.put("eventId", event.eventId());
        try {
            if (idempotencyStore.isProcessed(event.eventId())) {
                log.infof("중복 이벤트를 건너뜁니다: %s", event.eventId());
                return;
            }
            dispatch(event);
            idempotencyStore.markProcessed(event.eventId());
        } catch (InvalidPayloadException e) {
            log.warnf("이벤트 검증 실패로 처리 중단: %s", e.getMessage());
        } catch (StorageException e) {
            log.errorf(e, "저장소 오류로 이벤트 처리 중단: %s", event.eventId());
        } catch (RuntimeException e) {
            log.errorf(e, "이벤트 처리 중 예상치 못한 오류: %s", event.eventId());
        } finally {
            MDC.remove("correlationId");
            MDC.remove("eventId");
            MDC.remove("channelId");
        }
    }

    private void dispatch(GatewayEventPayload event) {
        switch (event.eventType()) {
            case MESSAGE_CREATE, MESSAGE_UPDATE -> {
                if (!event.isGuildMessage()) {
                    log.debugf("서버 밖 메시지는 무시합니다: %s", event.eventId());
                    return;
                }
                InboundMessage inbound = event.toInboundMessage();
                MDC.put("channelId", String.valueOf(inbound.channelId()));
                RelayResult result = relayMessageUseCase.relay(inbound);
                log.debugf("중계 결과: decision=%s forwarded=%d", result.decision(), result.forwardedCount());
            }
            case GUILD_CREATE -> guildLifecycleUseCase.joined(event.requireGuildId());
            case GUILD_DELETE -> guildLifecycleUseCase.removed(event.requireGuildId());
        }
    }

    private Optional<String> resolveCorrelationId(Message<String> message) {
        return message.getMetadata(IncomingRabbitMQMetadata.class)
                .flatMap(IncomingRabbitMQMetadata::getCorrelationId);
    }
}
