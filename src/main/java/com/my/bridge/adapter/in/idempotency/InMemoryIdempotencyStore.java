package com.my.bridge.adapter.in.idempotency;

import com.my.bridge.config.AppConfig;
import com.my.bridge.domain.port.out.ClockPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@IfBuildProperty(name = "app.idempotency.backend", stringValue = "memory")
@ApplicationScoped
public class InMemoryIdempotencyStore implements IdempotencyStore {

    private final ClockPort clockPort;
    private final Duration ttl;
    private final Map<String, Instant> processed = new ConcurrentHashMap<>();

    @Inject
    public InMemoryIdempotencyStore(ClockPort clockPort, AppConfig appConfig) {
        this(clockPort, Duration.ofHours(appConfig.idempotency().ttlHours()));
    }

    InMemoryIdempotencyStore(ClockPort clockPort, Duration ttl) {
        this.clockPort = clockPort;
        this.ttl = ttl;
    }

    @Override
    public boolean isProcessed(String eventId) {
        cleanup();
        return processed.containsKey(eventId);
    }

    @Override
    public void markProcessed(String eventId) {
        cleanup();
        processed.put(eventId, clockPort.now());
    }

    private void cleanup() {
        Instant cutoff = clockPort.now().minus(ttl);
        processed.entrySet().removeIf(entry -> entry.getValue().isBefore(cutoff));
    }
}
