package com.whereq.gridx.dto;

import com.whereq.gridx.model.JobPriority;
import com.whereq.gridx.model.JobSnapshot;
import com.whereq.gridx.model.JobStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One row of a job listing
 */
@Value
@Builder
public class JobSummary {
    String jobId;
    JobStatus status;
    String worker;
    String userId;
    JobPriority priority;
    Instant createdAt;
    Instant startedAt;
    Instant completedAt;
    double progress;
    String error;

    public static JobSummary from(JobSnapshot job) {
        return JobSummary.builder()
            .jobId(job.getJobId())
            .status(job.getStatus())
            .worker(job.getWorker())
            .userId(job.getUserId())
            .priority(job.getPriority())
            .createdAt(job.getCreatedAt())
            .startedAt(job.getStartedAt())
            .completedAt(job.getCompletedAt())
            .progress(job.getProgress())
            .error(job.getError())
            .build();
    }
}
