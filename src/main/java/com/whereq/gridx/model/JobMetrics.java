package com.whereq.gridx.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-job execution metrics
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobMetrics {
    /**
     * CPU load (percent) of the target worker when it was selected
     */
    private double cpuUsage;

    /**
     * Memory load (percent) of the target worker when it was selected
     */
    private double memoryUsage;

    /**
     * Seconds between start and completion
     */
    private double executionTimeSeconds;

    /**
     * Characters of stdout plus stderr
     */
    private long outputSize;
}
