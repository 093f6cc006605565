package com.whereq.gridx.model;

import com.whereq.gridx.analysis.AnalysisReport;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * A unit of scheduled work.
 * <p>
 * Every mutation goes through a synchronized method of this object, so the
 * pool task and the monitor never race on one job while different jobs never
 * block each other. A transition method returns {@code false} and writes
 * nothing when the job is no longer in a state the transition starts from;
 * once terminal, the job never changes again.
 */
public class ExecutionJob {

    private static final Set<JobStatus> STARTABLE = EnumSet.of(JobStatus.PENDING, JobStatus.ANALYZING);

    @Getter
    private final String jobId;

    @Getter
    private final String code;

    @Getter
    private final String userId;

    @Getter
    private final JobPriority priority;

    @Getter
    private final Instant createdAt;

    /**
     * Null means no timeout
     */
    @Getter
    private final Duration timeout;

    private volatile boolean cancellationRequested;

    private String worker;
    private JobStatus status = JobStatus.PENDING;
    private Instant startedAt;
    private Instant completedAt;
    private JobResult result;
    private String error;
    private AnalysisReport analysis;
    private JobMetrics metrics = new JobMetrics();
    private double progress;
    private Thread runner;

    public ExecutionJob(String jobId, String code, String worker, String userId,
                        JobPriority priority, Duration timeout, Instant createdAt) {
        this.jobId = jobId;
        this.code = code;
        this.worker = worker;
        this.userId = userId;
        this.priority = priority != null ? priority : JobPriority.NORMAL;
        this.timeout = timeout;
        this.createdAt = createdAt;
    }

    public boolean isCancellationRequested() {
        return cancellationRequested;
    }

    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized String getWorker() {
        return worker;
    }

    public synchronized Instant getCompletedAt() {
        return completedAt;
    }

    public synchronized boolean beginAnalysis() {
        if (status != JobStatus.PENDING) {
            return false;
        }
        status = JobStatus.ANALYZING;
        return true;
    }

    public synchronized boolean recordAnalysis(AnalysisReport report) {
        if (status.isTerminal()) {
            return false;
        }
        analysis = report;
        return true;
    }

    /**
     * PENDING or ANALYZING → RUNNING
     */
    public synchronized boolean start(Instant now) {
        if (!STARTABLE.contains(status)) {
            return false;
        }
        status = JobStatus.RUNNING;
        startedAt = now;
        return true;
    }

    public synchronized boolean complete(JobResult jobResult, Instant now) {
        if (status != JobStatus.RUNNING) {
            return false;
        }
        status = JobStatus.COMPLETED;
        result = jobResult;
        progress = 1.0;
        finish(now);
        if (jobResult != null) {
            metrics.setOutputSize(jobResult.outputSize());
        }
        return true;
    }

    public synchronized boolean fail(String message, JobResult jobResult, Instant now) {
        if (status.isTerminal()) {
            return false;
        }
        status = JobStatus.FAILED;
        error = message;
        result = jobResult;
        finish(now);
        if (jobResult != null) {
            metrics.setOutputSize(jobResult.outputSize());
        }
        return true;
    }

    /**
     * Raise the cancellation signal and move straight to CANCELLED
     *
     * @param interruptRunner also interrupt the pool thread running this job
     */
    public synchronized boolean cancel(Instant now, boolean interruptRunner) {
        return terminate(JobStatus.CANCELLED, null, now, interruptRunner);
    }

    /**
     * Same path as {@link #cancel}, ending in TIMEOUT
     */
    public synchronized boolean expire(Instant now, boolean interruptRunner) {
        if (status != JobStatus.RUNNING || timeout == null) {
            return false;
        }
        String message = "Job exceeded timeout of " + timeout.toSeconds() + " seconds";
        return terminate(JobStatus.TIMEOUT, message, now, interruptRunner);
    }

    private boolean terminate(JobStatus target, String message, Instant now, boolean interruptRunner) {
        if (!status.isCancellable()) {
            return false;
        }
        cancellationRequested = true;
        status = target;
        if (message != null) {
            error = message;
        }
        finish(now);
        if (interruptRunner && runner != null) {
            runner.interrupt();
        }
        return true;
    }

    private void finish(Instant now) {
        completedAt = now;
        if (startedAt != null) {
            metrics.setExecutionTimeSeconds(Duration.between(startedAt, now).toMillis() / 1000.0);
        }
    }

    /**
     * Bind the current pool thread. Fails when the job was cancelled before
     * the task got a thread.
     */
    public synchronized boolean attachRunner(Thread thread) {
        if (cancellationRequested || status != JobStatus.RUNNING) {
            return false;
        }
        runner = thread;
        return true;
    }

    public synchronized void detachRunner() {
        runner = null;
    }

    public synchronized boolean resolveWorker(String name) {
        if (status.isTerminal()) {
            return false;
        }
        worker = name;
        return true;
    }

    public synchronized boolean recordWorkerLoad(double cpuPercent, double memoryPercent) {
        if (status.isTerminal()) {
            return false;
        }
        metrics.setCpuUsage(cpuPercent);
        metrics.setMemoryUsage(memoryPercent);
        return true;
    }

    public synchronized boolean isTimedOut(Instant now) {
        return status == JobStatus.RUNNING
            && timeout != null
            && startedAt != null
            && Duration.between(startedAt, now).compareTo(timeout) > 0;
    }

    /**
     * Coarse time based estimate, kept below 1.0 until the job completes
     */
    public synchronized boolean updateProgress(Instant now) {
        if (status != JobStatus.RUNNING || startedAt == null) {
            return false;
        }
        long elapsedMs = Duration.between(startedAt, now).toMillis();
        if (timeout != null && !timeout.isZero()) {
            progress = Math.min(0.9, (double) elapsedMs / timeout.toMillis() * 0.8);
        } else {
            progress = Math.min(0.5, elapsedMs / 300_000.0);
        }
        return true;
    }

    public synchronized boolean isTerminalBefore(Instant cutoff) {
        return status.isTerminal() && completedAt != null && completedAt.isBefore(cutoff);
    }

    public synchronized JobSnapshot snapshot() {
        return JobSnapshot.builder()
            .jobId(jobId)
            .code(code)
            .worker(worker)
            .userId(userId)
            .status(status)
            .priority(priority)
            .createdAt(createdAt)
            .startedAt(startedAt)
            .completedAt(completedAt)
            .timeoutSeconds(timeout != null ? timeout.toSeconds() : null)
            .result(result)
            .error(error)
            .analysis(analysis)
            .metrics(metrics.toBuilder().build())
            .progress(progress)
            .cancellationRequested(cancellationRequested)
            .build();
    }
}
