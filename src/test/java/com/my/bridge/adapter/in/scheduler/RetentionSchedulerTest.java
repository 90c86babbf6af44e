package com.my.bridge.adapter.in.scheduler;

import com.my.bridge.config.AppConfig;
import com.my.bridge.domain.exception.StorageException;
import com.my.bridge.domain.port.in.RetentionUseCase;
import org.junit.jupiter.api.Test;
import org.mockito.Answers;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RetentionSchedulerTest {

    @Test
    void sweep_uses_configured_retention_days() {
        RetentionUseCase retention = mock(RetentionUseCase.class);
        RetentionScheduler scheduler = new RetentionScheduler(retention, config(45));

        scheduler.sweepSafely();

        verify(retention).sweep(45);
    }

    @Test
    void sweep_failure_is_logged_and_does_not_escape() {
        RetentionUseCase retention = mock(RetentionUseCase.class);
        when(retention.sweep(30)).thenThrow(new StorageException("db locked", null));
        RetentionScheduler scheduler = new RetentionScheduler(retention, config(30));

        assertThatCode(scheduler::sweepSafely).doesNotThrowAnyException();
        verify(retention).sweep(30);
    }

    private static AppConfig config(int days) {
        AppConfig config = mock(AppConfig.class, Answers.RETURNS_DEEP_STUBS);
        when(config.retention().days()).thenReturn(days);
        when(config.retention().sweepIntervalHours()).thenReturn(24);
        return config;
    }
}
