package com.whereq.gridx.service;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * Best-effort CPU and memory utilization of the host running the service.
 * Reports 0 when the JVM exposes no such data.
 */
@Slf4j
@Component
public class HostResourceMonitor {

    @Value("${gridx.host.alert-threshold.cpu-percent:90}")
    private double cpuAlertThreshold;

    @Value("${gridx.host.alert-threshold.memory-percent:90}")
    private double memoryAlertThreshold;

    private final MeterRegistry meterRegistry;
    private final OperatingSystemMXBean osBean;

    public HostResourceMonitor(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.osBean = ManagementFactory.getOperatingSystemMXBean();
    }

    @PostConstruct
    public void initialize() {
        Gauge.builder("gridx.host.cpu.utilization", this::getCpuPercent)
            .description("Host CPU utilization percentage")
            .register(meterRegistry);

        Gauge.builder("gridx.host.memory.utilization", this::getMemoryPercent)
            .description("Host memory utilization percentage")
            .register(meterRegistry);

        log.info("HostResourceMonitor initialized: {} processors, extended metrics {}",
            osBean.getAvailableProcessors(),
            osBean instanceof com.sun.management.OperatingSystemMXBean ? "available" : "unavailable");
    }

    public double getCpuPercent() {
        try {
            if (osBean instanceof com.sun.management.OperatingSystemMXBean extended) {
                double load = extended.getCpuLoad();
                return load >= 0 ? load * 100.0 : 0.0;
            }
        } catch (RuntimeException e) {
            log.debug("CPU load unavailable: {}", e.toString());
        }
        return 0.0;
    }

    public double getMemoryPercent() {
        try {
            if (osBean instanceof com.sun.management.OperatingSystemMXBean extended) {
                long total = extended.getTotalMemorySize();
                long free = extended.getFreeMemorySize();
                return total > 0 ? (total - free) * 100.0 / total : 0.0;
            }
        } catch (RuntimeException e) {
            log.debug("Memory usage unavailable: {}", e.toString());
        }
        return 0.0;
    }

    /**
     * Periodic host check
     */
    @Scheduled(fixedRateString = "${gridx.host.poll-interval-ms:30000}")
    public void monitorHost() {
        double cpuPercent = getCpuPercent();
        double memoryPercent = getMemoryPercent();

        if (cpuPercent > cpuAlertThreshold) {
            log.warn("HIGH CPU USAGE: {}% (threshold: {}%)", String.format("%.1f", cpuPercent), cpuAlertThreshold);
        }
        if (memoryPercent > memoryAlertThreshold) {
            log.warn("HIGH MEMORY USAGE: {}% (threshold: {}%)", String.format("%.1f", memoryPercent), memoryAlertThreshold);
        }
    }
}
