package com.my.bridge.adapter.out.metrics;

import com.my.bridge.domain.model.ProcessMetrics;
import com.my.bridge.domain.port.out.RuntimeMetricsPort;
import jakarta.enterprise.context.ApplicationScoped;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.time.Duration;

/**
 * 왜: 봇 통계의 프로세스 항목(메모리, 스레드, 가동 시간)을 JVM 관리 빈에서 읽어 도메인 값으로 넘기기 위함.
 */
@ApplicationScoped
public class JvmRuntimeMetricsAdapter implements RuntimeMetricsPort {

    private static final double MB = 1024.0 * 1024.0;

    @Override
    public ProcessMetrics snapshot() {
        MemoryMXBean memory = ManagementFactory.getMemoryMXBean();
        MemoryUsage heap = memory.getHeapMemoryUsage();
        long max = heap.getMax() > 0 ? heap.getMax() : Runtime.getRuntime().maxMemory();
        return new ProcessMetrics(
                heap.getUsed() / MB,
                max / MB,
                ManagementFactory.getThreadMXBean().getThreadCount(),
                Runtime.getRuntime().availableProcessors(),
                Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime()));
    }
}
