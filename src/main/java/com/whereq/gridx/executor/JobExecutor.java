package com.whereq.gridx.executor;

import com.whereq.gridx.model.ExecutionJob;
import com.whereq.gridx.model.JobResult;

/**
 * Execution function handed to the job manager
 */
@FunctionalInterface
public interface JobExecutor {
    /**
     * Execute a job synchronously (blocking)
     *
     * @param job the running job
     * @return job result
     * @throws Exception if execution fails; the job is then marked FAILED
     */
    JobResult execute(ExecutionJob job) throws Exception;
}
