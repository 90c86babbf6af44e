package com.my.bridge.domain.model;

import java.time.Duration;

public record ProcessMetrics(double usedMemoryMb, double maxMemoryMb, int liveThreads, int availableProcessors, Duration uptime) {
}
