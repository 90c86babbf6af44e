package com.my.bridge.domain.port.out;

import com.my.bridge.domain.model.MessageLogEntry;
import com.my.bridge.domain.model.MessageStats;

import java.time.Instant;

public interface MessageLogRepository {

    void append(MessageLogEntry entry);

    boolean exists(long originalMessageId, long connectionId);

    MessageStats statsSince(Instant since);

    MessageStats statsForConnectionSince(long connectionId, Instant since);

    long countAll();
}
