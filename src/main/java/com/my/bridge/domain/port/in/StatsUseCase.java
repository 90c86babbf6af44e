package com.my.bridge.domain.port.in;

import com.my.bridge.domain.model.BotStats;
import com.my.bridge.domain.model.ServerStats;

public interface StatsUseCase {

    BotStats botStats();

    ServerStats serverStats(long serverId);
}
