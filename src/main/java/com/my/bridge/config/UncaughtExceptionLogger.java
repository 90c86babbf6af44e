package com.my.bridge.config;

import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * 왜: 소비자 경계 밖(스케줄러, 비동기 후속 작업 등)에서 새어 나온 예외도 조용히 사라지지 않고 로그에 남게 하기 위함.
 */
@Startup
@ApplicationScoped
public class UncaughtExceptionLogger {

    private static final Logger log = Logger.getLogger(UncaughtExceptionLogger.class);

    @PostConstruct
    void install() {
        Thread.setDefaultUncaughtExceptionHandler((thread, error) ->
                log.errorf(error, "처리되지 않은 예외: thread=%s", thread.getName()));
    }
}
