package com.my.bridge.adapter.out.reply;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.bridge.domain.exception.TransportException;
import com.my.bridge.domain.model.CommandReply;
import org.eclipse.microprofile.reactive.messaging.Emitter;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class RabbitReplyProducerTest {

    @Test
    void send_serializes_reply_and_emits() throws Exception {
        @SuppressWarnings("unchecked")
        Emitter<String> emitter = (Emitter<String>) mock(Emitter.class);
        ObjectMapper mapper = new ObjectMapper();
        RabbitReplyProducer producer = new RabbitReplyProducer(emitter, mapper);
        CommandReply reply = new CommandReply("req-1", 55L, CommandReply.ReplyStatus.OK,
                "CONNECTION_CREATED", "연결이 생성되었습니다", Map.of("connectionId", 7));

        producer.send(reply);

        ArgumentCaptor<String> payloadCaptor = ArgumentCaptor.forClass(String.class);
        verify(emitter).send(payloadCaptor.capture());
        JsonNode json = mapper.readTree(payloadCaptor.getValue());
        assertThat(json.get("requestId").asText()).isEqualTo("req-1");
        assertThat(json.get("channelId").asLong()).isEqualTo(55L);
        assertThat(json.get("status").asText()).isEqualTo("OK");
        assertThat(json.get("code").asText()).isEqualTo("CONNECTION_CREATED");
        assertThat(json.get("data").get("connectionId").asInt()).isEqualTo(7);
    }

    @Test
    void serialization_failure_becomes_transport_exception() throws Exception {
        @SuppressWarnings("unchecked")
        Emitter<String> emitter = (Emitter<String>) mock(Emitter.class);
        ObjectMapper mapper = mock(ObjectMapper.class);
        when(mapper.writeValueAsString(any())).thenThrow(new JsonMappingException(null, "boom"));
        RabbitReplyProducer producer = new RabbitReplyProducer(emitter, mapper);
        CommandReply reply = new CommandReply("req-2", 1L, CommandReply.ReplyStatus.ERROR, "X", "x", null);

        assertThatThrownBy(() -> producer.send(reply))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("req-2");
        verifyNoInteractions(emitter);
    }
}
