package com.whereq.gridx.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.gridx.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of a job control action. A refused action keeps
 * {@code success=false} and the job's current status.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobControlResponse {

    private String jobId;

    /**
     * Normalized action name, e.g. "cancel"
     */
    private String action;

    private boolean success;

    private JobStatus status;

    /**
     * Null unless the action cancelled the job
     */
    private Instant cancelledAt;

    private String message;
}
