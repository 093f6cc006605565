package com.whereq.gridx.service;

import com.whereq.gridx.config.GridxProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic supervision of the job table. Never blocks on a worker; only
 * inspects timestamps and flips job state.
 */
@Slf4j
@Component
public class JobMonitor {

    @Autowired
    private JobManager jobManager;

    @Autowired
    private GridxProperties properties;

    @Scheduled(fixedRateString = "${gridx.jobs.monitor-interval-ms:1000}")
    public void monitorJobs() {
        try {
            int expired = jobManager.monitorJobs();
            if (expired > 0) {
                log.debug("Monitor tick: {} job(s) timed out", expired);
            }
        } catch (RuntimeException e) {
            log.error("Job monitor tick failed", e);
        }
    }

    /**
     * Retention sweep over terminal jobs
     */
    @Scheduled(fixedRateString = "${gridx.jobs.retention-sweep-interval-ms:3600000}",
        initialDelayString = "${gridx.jobs.retention-sweep-interval-ms:3600000}")
    public void sweepRetention() {
        try {
            jobManager.cleanup(properties.getJobs().getRetentionMaxAge());
        } catch (RuntimeException e) {
            log.error("Job retention sweep failed", e);
        }
    }
}
