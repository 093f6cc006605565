package com.whereq.gridx.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Result payload of a job's remote execution
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResult {
    /**
     * Worker the command ran on
     */
    private String worker;

    /**
     * Standard output
     */
    private String output;

    /**
     * Standard error
     */
    private String error;

    /**
     * Process exit code reported by the worker agent
     */
    private Integer exitCode;

    /**
     * Whether the worker was picked by the selector
     */
    private boolean autoSelected;

    /**
     * Round trip time of the remote call in milliseconds
     */
    private long executionTimeMs;

    /**
     * When the remote call returned
     */
    private Instant completedAt;

    public long outputSize() {
        return (output != null ? output.length() : 0) + (error != null ? error.length() : 0);
    }
}
