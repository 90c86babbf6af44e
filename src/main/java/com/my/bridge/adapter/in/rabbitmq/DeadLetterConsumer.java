package com.my.bridge.adapter.in.rabbitmq;

import io.quarkus.arc.profile.IfBuildProfile;
import io.smallrye.reactive.messaging.annotations.Blocking;
import io.smallrye.reactive.messaging.rabbitmq.IncomingRabbitMQMetadata;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * 왜: 브로커가 거부한 게이트웨이 이벤트의 적체를 로그로 드러내기 위해 DLQ 전용 소비자를 둔다. 재처리는 하지 않는다.
 */
@IfBuildProfile("prod")
@ApplicationScoped
public class DeadLetterConsumer {

    private static final Logger log = Logger.getLogger(DeadLetterConsumer.class);
    private static final int PAYLOAD_PREVIEW = 500;

    @Incoming("gateway-events-dlq")
    @Blocking
    public CompletionStage<Void> consume(Message<String> message) {
        Optional<Map<String, Object>> headers = message.getMetadata(IncomingRabbitMQMetadata.class)
                .map(IncomingRabbitMQMetadata::getHeaders);
        String reason = header(headers, "x-first-death-reason");
        String queue = header(headers, "x-first-death-queue");
        String payload = message.getPayload();
        String preview = payload == null || payload.length() <= PAYLOAD_PREVIEW ? payload : payload.substring(0, PAYLOAD_PREVIEW) + "...";
        log.warnf("DLQ 소비: reason=%s, queue=%s, payload=%s", reason, queue, preview);
        return message.ack();
    }

    private static String header(Optional<Map<String, Object>> headers, String name) {
        return headers.map(values -> String.valueOf(values.getOrDefault(name, "unknown"))).orElse("unknown");
    }
}
