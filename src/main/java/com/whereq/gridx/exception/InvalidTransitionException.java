package com.whereq.gridx.exception;

import com.whereq.gridx.model.JobStatus;

/**
 * Exception thrown when a job is asked to leave a state it cannot leave,
 * e.g. cancelling a terminal job or submitting it twice
 */
public class InvalidTransitionException extends GridxException {
    public InvalidTransitionException(String jobId, JobStatus current, String action) {
        super("Cannot " + action + " job " + jobId + " in status " + current);
    }
}
