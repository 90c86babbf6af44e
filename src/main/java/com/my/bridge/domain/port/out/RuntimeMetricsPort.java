package com.my.bridge.domain.port.out;

import com.my.bridge.domain.model.ProcessMetrics;

public interface RuntimeMetricsPort {
    ProcessMetrics snapshot();
}
