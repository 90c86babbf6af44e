package com.my.bridge.adapter.in.scheduler;

import com.my.bridge.config.AppConfig;
import com.my.bridge.domain.port.in.RetentionUseCase;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 왜: 보존 기간이 지난 스팸 추적 행을 관리자 명령 없이도 주기적으로 정리하기 위함.
 */
@Startup
@ApplicationScoped
public class RetentionScheduler {

    private static final Logger log = Logger.getLogger(RetentionScheduler.class);

    private final RetentionUseCase retentionUseCase;
    private final int retentionDays;
    private final int intervalHours;
    private final ScheduledExecutorService executor;

    @Inject
    public RetentionScheduler(RetentionUseCase retentionUseCase, AppConfig appConfig) {
        this.retentionUseCase = retentionUseCase;
        this.retentionDays = appConfig.retention().days();
        this.intervalHours = appConfig.retention().sweepIntervalHours();
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "retention-sweeper");
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    void start() {
        executor.scheduleWithFixedDelay(this::sweepSafely, 1, TimeUnit.HOURS.toMinutes(intervalHours), TimeUnit.MINUTES);
        log.infof("보존 기간 정리 예약: %d일 보존, %d시간 간격", retentionDays, intervalHours);
    }

    void sweepSafely() {
        try {
            retentionUseCase.sweep(retentionDays);
        } catch (Exception e) {
            log.warnf("보존 기간 정리 중 예외: %s", e.getMessage());
        }
    }

    @PreDestroy
    void stop() {
        executor.shutdownNow();
    }
}
