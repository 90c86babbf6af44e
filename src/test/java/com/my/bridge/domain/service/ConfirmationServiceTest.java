package com.my.bridge.domain.service;

import com.my.bridge.adapter.out.signal.InMemorySignalAwaiter;
import com.my.bridge.domain.exception.NotFoundException;
import com.my.bridge.domain.model.ConfirmationSignal;
import com.my.bridge.domain.model.ConfirmationState;
import com.my.bridge.domain.model.PendingConfirmation;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfirmationServiceTest {

    private final ConfirmationService service =
            new ConfirmationService(new InMemorySignalAwaiter<ConfirmationSignal>(Runnable::run), Duration.ofSeconds(5));

    @Test
    void requester_approval_confirms() throws Exception {
        PendingConfirmation pending = service.begin(7L, "cleanup:30");

        service.respond(pending.id(), 7L, true);

        assertThat(state(pending)).isEqualTo(ConfirmationState.CONFIRMED);
    }

    @Test
    void requester_decline_cancels() throws Exception {
        PendingConfirmation pending = service.begin(7L, "cleanup:30");

        service.respond(pending.id(), 7L, false);

        assertThat(state(pending)).isEqualTo(ConfirmationState.DECLINED);
    }

    @Test
    void other_users_cannot_answer() {
        PendingConfirmation pending = service.begin(7L, "connection-remove:3");

        assertThatThrownBy(() -> service.respond(pending.id(), 8L, true)).isInstanceOf(NotFoundException.class);
        assertThat(pending.outcome().toCompletableFuture().isDone()).isFalse();
    }

    @Test
    void unknown_id_is_not_found() {
        assertThatThrownBy(() -> service.respond("missing", 7L, true)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void silence_expires() throws Exception {
        ConfirmationService quick = new ConfirmationService(
                new InMemorySignalAwaiter<ConfirmationSignal>(Runnable::run), Duration.ofMillis(50));

        PendingConfirmation pending = quick.begin(7L, "cleanup:30");

        assertThat(state(pending)).isEqualTo(ConfirmationState.EXPIRED);
        assertThatThrownBy(() -> quick.respond(pending.id(), 7L, true)).isInstanceOf(NotFoundException.class);
    }

    private static ConfirmationState state(PendingConfirmation pending) throws Exception {
        return pending.outcome().toCompletableFuture().get(2, TimeUnit.SECONDS);
    }
}
