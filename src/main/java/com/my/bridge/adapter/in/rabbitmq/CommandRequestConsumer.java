package com.my.bridge.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.bridge.domain.exception.InvalidPayloadException;
import io.smallrye.mutiny.Uni;
import io.smallrye.reactive.messaging.annotations.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.io.IOException;

/**
 * 왜: 명령 파싱 계층이 보낸 관리 명령을 디스패처로 넘기는 진입 어댑터가 필요하기 때문.
 */
@ApplicationScoped
public class CommandRequestConsumer {

    private static final Logger log = Logger.getLogger(CommandRequestConsumer.class);

    private final CommandDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    @Inject
    public CommandRequestConsumer(CommandDispatcher dispatcher, ObjectMapper objectMapper) {
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
    }

    @Incoming("bridge-commands")
    @Blocking(ordered = false)
    public Uni<Void> consume(Message<String> message) {
        return Uni.createFrom().item(() -> {
            handle(message.getPayload());
            return null;
        }).replaceWithVoid().chain(() -> Uni.createFrom().completionStage(message.ack()));
    }

    void handle(String payload) {
        CommandRequest request;
        try {
            request = objectMapper.readValue(payload, CommandRequest.class);
        } catch (IOException | InvalidPayloadException e) {
            log.warnf("명령 요청 파싱 실패로 처리 중단: %s", e.getMessage());
            return;
        }
        MDC.put("requestId", request.requestId());
        try {
            dispatcher.dispatch(request);
        } catch (RuntimeException e) {
            log.errorf(e, "명령 처리 실패: %s", request.command());
        } finally {
            MDC.remove("requestId");
        }
    }
}
