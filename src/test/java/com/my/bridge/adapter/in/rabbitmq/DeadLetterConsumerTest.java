package com.my.bridge.adapter.in.rabbitmq;

import org.eclipse.microprofile.reactive.messaging.Message;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class DeadLetterConsumerTest {

    @Test
    void acks_dead_letters_without_metadata() {
        AtomicBoolean acked = new AtomicBoolean();
        Message<String> message = Message.of("x".repeat(800)).withAck(() -> {
            acked.set(true);
            return CompletableFuture.completedFuture(null);
        });

        new DeadLetterConsumer().consume(message).toCompletableFuture().join();

        assertThat(acked).isTrue();
    }
}
