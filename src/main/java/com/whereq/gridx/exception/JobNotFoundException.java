package com.whereq.gridx.exception;

public class JobNotFoundException extends GridxException {
    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
    }
}
