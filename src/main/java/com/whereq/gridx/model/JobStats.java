package com.whereq.gridx.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Aggregate view over the job table
 */
@Value
@Builder
public class JobStats {
    long totalJobs;
    long runningJobs;

    /**
     * Job count per status, every status present
     */
    Map<JobStatus, Long> byStatus;

    /**
     * Job count per worker; unresolved jobs count under "unassigned"
     */
    Map<String, Long> byWorker;

    /**
     * Mean execution time of completed jobs, seconds
     */
    double avgExecutionTime;

    double currentCpuUsage;
    double currentMemoryUsage;
}
