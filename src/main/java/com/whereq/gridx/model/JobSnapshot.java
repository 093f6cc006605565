package com.whereq.gridx.model;

import com.whereq.gridx.analysis.AnalysisReport;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Consistent read-only copy of an {@link ExecutionJob}
 */
@Value
@Builder
public class JobSnapshot {
    String jobId;
    String code;
    String worker;
    String userId;
    JobStatus status;
    JobPriority priority;
    Instant createdAt;
    Instant startedAt;
    Instant completedAt;
    Long timeoutSeconds;
    JobResult result;
    String error;
    AnalysisReport analysis;
    JobMetrics metrics;
    double progress;
    boolean cancellationRequested;
}
