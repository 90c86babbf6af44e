package com.my.bridge.domain.service;

import com.my.bridge.adapter.out.persistence.InMemorySpamTrackingRepository;
import com.my.bridge.adapter.out.signal.InMemorySignalAwaiter;
import com.my.bridge.domain.exception.ValidationError;
import com.my.bridge.domain.exception.ValidationException;
import com.my.bridge.domain.model.Actor;
import com.my.bridge.domain.model.CleanupResult;
import com.my.bridge.domain.model.ConfirmationSignal;
import com.my.bridge.domain.model.ConfirmationState;
import com.my.bridge.domain.model.SpamKey;
import com.my.bridge.domain.model.SpamTrackingEntry;
import com.my.bridge.domain.port.in.RetentionUseCase;
import com.my.bridge.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetentionServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-31T00:00:00Z");

    private InMemorySpamTrackingRepository repository;
    private ConfirmationService confirmations;
    private RetentionService service;
    private final Actor admin = new Actor(1L, 10L, 100L, true, true);

    @BeforeEach
    void setUp() {
        repository = new InMemorySpamTrackingRepository();
        confirmations = new ConfirmationService(new InMemorySignalAwaiter<ConfirmationSignal>(Runnable::run), Duration.ofSeconds(5));
        service = new RetentionService(repository, confirmations, new MutableClock(NOW), 7);
        seen(1L, NOW.minus(Duration.ofDays(40)));
        seen(2L, NOW.minus(Duration.ofDays(31)));
        seen(3L, NOW.minus(Duration.ofDays(2)));
    }

    @Test
    void sweep_removes_only_rows_older_than_cutoff() {
        assertThat(service.sweep(30)).isEqualTo(2);

        assertThat(repository.find(new SpamKey(3L, 10L, 100L))).isPresent();
        assertThat(repository.find(new SpamKey(1L, 10L, 100L))).isEmpty();
    }

    @Test
    void too_short_retention_is_rejected() {
        assertThatThrownBy(() -> service.sweep(3))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.error()).isEqualTo(ValidationError.RETENTION_TOO_SHORT));
        assertThatThrownBy(() -> service.requestCleanup(admin, 6)).isInstanceOf(ValidationException.class);
    }

    @Test
    void confirmed_cleanup_deletes() throws Exception {
        RetentionUseCase.Cleanup cleanup = service.requestCleanup(admin, 30);

        assertThat(cleanup.confirmation().subject()).isEqualTo("cleanup:30");
        confirmations.respond(cleanup.confirmation().id(), admin.userId(), true);
        CleanupResult result = cleanup.result().toCompletableFuture().get(2, TimeUnit.SECONDS);

        assertThat(result).isEqualTo(new CleanupResult(30, ConfirmationState.CONFIRMED, 2));
    }

    @Test
    void declined_cleanup_deletes_nothing() throws Exception {
        RetentionUseCase.Cleanup cleanup = service.requestCleanup(admin, 30);

        confirmations.respond(cleanup.confirmation().id(), admin.userId(), false);
        CleanupResult result = cleanup.result().toCompletableFuture().get(2, TimeUnit.SECONDS);

        assertThat(result.deletedRows()).isZero();
        assertThat(result.state()).isEqualTo(ConfirmationState.DECLINED);
        assertThat(repository.find(new SpamKey(1L, 10L, 100L))).isPresent();
    }

    private void seen(long userId, Instant last) {
        repository.save(new SpamTrackingEntry(new SpamKey(userId, 10L, 100L), 1, last, last, false));
    }
}
