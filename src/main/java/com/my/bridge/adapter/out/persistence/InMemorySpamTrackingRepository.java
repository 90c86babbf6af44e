package com.my.bridge.adapter.out.persistence;

import com.my.bridge.domain.model.SpamKey;
import com.my.bridge.domain.model.SpamTrackingEntry;
import com.my.bridge.domain.port.out.SpamTrackingRepository;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@IfBuildProperty(name = "app.spam.backend", stringValue = "memory")
@ApplicationScoped
public class InMemorySpamTrackingRepository implements SpamTrackingRepository {

    private final Map<SpamKey, SpamTrackingEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<SpamTrackingEntry> find(SpamKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void save(SpamTrackingEntry entry) {
        entries.put(entry.key(), entry);
    }

    @Override
    public int deleteLastSeenBefore(Instant cutoff) {
        int before = entries.size();
        entries.values().removeIf(entry -> entry.lastMessageTime().isBefore(cutoff));
        return before - entries.size();
    }
}
