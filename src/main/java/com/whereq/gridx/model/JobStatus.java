package com.whereq.gridx.model;

/**
 * Job lifecycle states
 *
 * State transitions:
 * PENDING → [ANALYZING →] RUNNING → {COMPLETED, FAILED, CANCELLED, TIMEOUT}
 * ANALYZING → FAILED (rejected by static analysis)
 * PENDING, ANALYZING → CANCELLED
 */
public enum JobStatus {
    /**
     * Job created, not yet handed to the execution pool
     */
    PENDING,

    /**
     * Static analysis in progress
     */
    ANALYZING,

    /**
     * Handed to the execution pool
     */
    RUNNING,

    /**
     * Completed successfully
     */
    COMPLETED,

    /**
     * Terminated with error
     */
    FAILED,

    /**
     * User-initiated cancellation
     */
    CANCELLED,

    /**
     * Exceeded its timeout
     */
    TIMEOUT;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED || this == TIMEOUT;
    }

    /**
     * Check if the job can still be cancelled
     */
    public boolean isCancellable() {
        return this == PENDING || this == ANALYZING || this == RUNNING;
    }
}
