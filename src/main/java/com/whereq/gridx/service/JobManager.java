package com.whereq.gridx.service;

import com.whereq.gridx.analysis.AnalysisReport;
import com.whereq.gridx.analysis.AnalyzerRegistry;
import com.whereq.gridx.analysis.CodeAnalyzer;
import com.whereq.gridx.config.GridxProperties;
import com.whereq.gridx.exception.AnalysisRejectedException;
import com.whereq.gridx.exception.DispatchFailedException;
import com.whereq.gridx.exception.InvalidTransitionException;
import com.whereq.gridx.exception.JobNotFoundException;
import com.whereq.gridx.executor.JobExecutor;
import com.whereq.gridx.model.ExecutionJob;
import com.whereq.gridx.model.JobPriority;
import com.whereq.gridx.model.JobResult;
import com.whereq.gridx.model.JobSnapshot;
import com.whereq.gridx.model.JobStats;
import com.whereq.gridx.model.JobStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the job table, the bounded execution pool and the timeout sweep.
 * <p>
 * Pool tasks and the monitor race for a job's terminal transition; the job's
 * own lock decides the winner and the loser's write is a no-op.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class JobManager {

    static final String UNASSIGNED = "unassigned";

    private final Map<String, ExecutionJob> jobs = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final GridxProperties.JobsConfig config;
    private final AnalyzerRegistry analyzerRegistry;
    private final HostResourceMonitor hostResourceMonitor;
    private final ThreadPoolExecutor pool;

    private Counter completedCounter;
    private Counter failedCounter;
    private Counter cancelledCounter;
    private Counter timeoutCounter;
    private Timer executionTimer;

    public JobManager(Clock clock, MeterRegistry meterRegistry, GridxProperties properties,
                      AnalyzerRegistry analyzerRegistry, HostResourceMonitor hostResourceMonitor) {
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.config = properties.getJobs();
        this.analyzerRegistry = analyzerRegistry;
        this.hostResourceMonitor = hostResourceMonitor;
        int poolSize = Math.max(1, config.getPoolSize());
        this.pool = new ThreadPoolExecutor(poolSize, poolSize, 0L, TimeUnit.MILLISECONDS,
            new PriorityBlockingQueue<>(), new CustomizableThreadFactory("gridx-job-"));
    }

    @PostConstruct
    public void initialize() {
        completedCounter = Counter.builder("gridx.jobs.completed")
            .description("Number of successfully completed jobs")
            .register(meterRegistry);

        failedCounter = Counter.builder("gridx.jobs.failed")
            .description("Number of failed jobs")
            .register(meterRegistry);

        cancelledCounter = Counter.builder("gridx.jobs.cancelled")
            .description("Number of cancelled jobs")
            .register(meterRegistry);

        timeoutCounter = Counter.builder("gridx.jobs.timeout")
            .description("Number of jobs stopped by their timeout")
            .register(meterRegistry);

        executionTimer = Timer.builder("gridx.jobs.execution.time")
            .description("Job execution time")
            .register(meterRegistry);

        Gauge.builder("gridx.jobs.running", this, manager -> manager.countByStatus(JobStatus.RUNNING))
            .description("Number of running jobs")
            .register(meterRegistry);

        Gauge.builder("gridx.jobs.queued", pool, executor -> executor.getQueue().size())
            .description("Number of jobs waiting for a pool slot")
            .register(meterRegistry);

        log.info("JobManager initialized: pool size={}, interrupt on cancel={}",
            pool.getCorePoolSize(), config.isInterruptOnCancel());
    }

    /**
     * Register a new job in PENDING
     *
     * @param timeout null for no timeout
     * @return job id
     */
    public String create(String code, String worker, String userId, JobPriority priority, Duration timeout) {
        String jobId = UUID.randomUUID().toString();
        String user = userId == null || userId.isBlank() ? config.getDefaultUser() : userId;
        ExecutionJob job = new ExecutionJob(jobId, code, worker, user, priority, timeout, clock.instant());
        jobs.put(jobId, job);
        log.info("Job {} created for user {} (worker={}, priority={}, timeout={})",
            jobId, user, worker != null ? worker : "auto", job.getPriority(), timeout);
        return jobId;
    }

    /**
     * Attach an analysis made before the job was created
     */
    public void recordAnalysis(String jobId, AnalysisReport report) {
        require(jobId).recordAnalysis(report);
    }

    /**
     * PENDING → RUNNING and hand the job to the pool
     *
     * @return false when the job is not PENDING
     * @throws JobNotFoundException for an unknown id
     */
    public boolean submit(String jobId, JobExecutor executor) {
        ExecutionJob job = require(jobId);
        if (!job.start(clock.instant())) {
            log.warn("Job {} not submitted: status is {}", jobId, job.getStatus());
            return false;
        }
        return schedule(job, executor);
    }

    /**
     * PENDING → ANALYZING → RUNNING; a rejected verdict ends the job in FAILED
     * with the verdict attached
     *
     * @return false when the job was not PENDING or was rejected
     */
    public boolean submitWithAnalysis(String jobId, String language, JobExecutor executor) {
        ExecutionJob job = require(jobId);
        CodeAnalyzer analyzer = analyzerRegistry.forLanguage(language);
        if (!job.beginAnalysis()) {
            log.warn("Job {} not submitted: status is {}", jobId, job.getStatus());
            return false;
        }
        log.info("Job {} status updated: ANALYZING", jobId);

        AnalysisReport report = analyzer.analyze(job.getCode());
        job.recordAnalysis(report);
        if (!report.isShouldExecute()) {
            String message = new AnalysisRejectedException(report).getMessage();
            if (job.fail(message, null, clock.instant())) {
                failedCounter.increment();
                log.info("Job {} status updated: FAILED ({})", jobId, message);
            }
            return false;
        }
        if (!job.start(clock.instant())) {
            log.info("Job {} left ANALYZING before it could start: {}", jobId, job.getStatus());
            return false;
        }
        return schedule(job, executor);
    }

    private boolean schedule(ExecutionJob job, JobExecutor executor) {
        log.info("Job {} status updated: RUNNING (priority {})", job.getJobId(), job.getPriority());
        try {
            pool.execute(new JobTask(job, executor, sequence.incrementAndGet()));
            return true;
        } catch (RejectedExecutionException e) {
            log.error("Job {} rejected by the execution pool", job.getJobId(), e);
            if (job.fail("Execution pool is shut down", null, clock.instant())) {
                failedCounter.increment();
            }
            return false;
        }
    }

    /**
     * Request cancellation; the job is CANCELLED as soon as this returns true
     *
     * @return false when the job is unknown or already terminal
     */
    public boolean cancel(String jobId) {
        ExecutionJob job = jobs.get(jobId);
        if (job == null) {
            return false;
        }
        if (!job.cancel(clock.instant(), config.isInterruptOnCancel())) {
            log.debug("Job {} not cancelled: status is {}", jobId, job.getStatus());
            return false;
        }
        cancelledCounter.increment();
        log.info("Job {} status updated: CANCELLED", jobId);
        return true;
    }

    /**
     * Same as {@link #cancel} but reports why it failed
     */
    public JobSnapshot cancelJob(String jobId) {
        ExecutionJob job = require(jobId);
        if (!cancel(jobId)) {
            throw new InvalidTransitionException(jobId, job.getStatus(), "cancel");
        }
        return job.snapshot();
    }

    public Optional<JobSnapshot> getJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(ExecutionJob::snapshot);
    }

    public JobSnapshot requireJob(String jobId) {
        return require(jobId).snapshot();
    }

    /**
     * All jobs, newest first
     */
    public List<JobSnapshot> getJobs() {
        return jobs.values().stream()
            .map(ExecutionJob::snapshot)
            .sorted(Comparator.comparing(JobSnapshot::getCreatedAt).reversed())
            .toList();
    }

    public List<JobSnapshot> getUserJobs(String userId) {
        return getJobs().stream()
            .filter(job -> job.getUserId().equals(userId))
            .toList();
    }

    public List<JobSnapshot> getRunningJobs() {
        return getJobs().stream()
            .filter(job -> job.getStatus() == JobStatus.RUNNING)
            .toList();
    }

    /**
     * One monitor pass: time out expired jobs, refresh progress of the rest.
     * A failure on one job is logged and the pass continues.
     *
     * @return number of jobs moved to TIMEOUT
     */
    public int monitorJobs() {
        Instant now = clock.instant();
        int expired = 0;
        for (ExecutionJob job : jobs.values()) {
            try {
                if (job.isTimedOut(now)) {
                    if (job.expire(now, config.isInterruptOnCancel())) {
                        expired++;
                        timeoutCounter.increment();
                        log.warn("Job {} status updated: TIMEOUT after {}s", job.getJobId(),
                            job.getTimeout().toSeconds());
                    }
                } else {
                    job.updateProgress(now);
                }
            } catch (RuntimeException e) {
                log.error("Monitoring job {} failed", job.getJobId(), e);
            }
        }
        return expired;
    }

    /**
     * Remove terminal jobs completed more than {@code maxAge} ago
     *
     * @return number removed
     */
    public int cleanup(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        int removed = 0;
        for (Map.Entry<String, ExecutionJob> entry : jobs.entrySet()) {
            if (entry.getValue().isTerminalBefore(cutoff) && jobs.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Removed {} job(s) completed before {}", removed, cutoff);
        }
        return removed;
    }

    public JobStats stats() {
        List<JobSnapshot> snapshots = jobs.values().stream().map(ExecutionJob::snapshot).toList();

        Map<JobStatus, Long> byStatus = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            byStatus.put(status, 0L);
        }
        Map<String, Long> byWorker = new TreeMap<>();
        double totalTime = 0;
        int completed = 0;
        for (JobSnapshot job : snapshots) {
            byStatus.merge(job.getStatus(), 1L, Long::sum);
            byWorker.merge(job.getWorker() != null ? job.getWorker() : UNASSIGNED, 1L, Long::sum);
            if (job.getStatus() == JobStatus.COMPLETED && job.getStartedAt() != null && job.getCompletedAt() != null) {
                totalTime += Duration.between(job.getStartedAt(), job.getCompletedAt()).toMillis() / 1000.0;
                completed++;
            }
        }

        return JobStats.builder()
            .totalJobs(snapshots.size())
            .runningJobs(byStatus.get(JobStatus.RUNNING))
            .byStatus(byStatus)
            .byWorker(byWorker)
            .avgExecutionTime(completed > 0 ? Math.round(totalTime / completed * 100) / 100.0 : 0.0)
            .currentCpuUsage(hostResourceMonitor.getCpuPercent())
            .currentMemoryUsage(hostResourceMonitor.getMemoryPercent())
            .build();
    }

    /**
     * Heuristic warnings about a job that may be running away
     */
    public List<String> detectSuspiciousPatterns(JobSnapshot job) {
        if (job.getStatus() != JobStatus.RUNNING || job.getStartedAt() == null) {
            return List.of();
        }
        double elapsed = Duration.between(job.getStartedAt(), clock.instant()).toMillis() / 1000.0;
        List<String> patterns = new ArrayList<>();
        if (job.getMetrics().getCpuUsage() > 90 && elapsed > 30) {
            patterns.add("sustained_high_cpu");
        }
        if (job.getMetrics().getMemoryUsage() > 80) {
            patterns.add("high_memory_usage");
        }
        if (elapsed > 300 && job.getProgress() < 0.1) {
            patterns.add("long_execution_no_progress");
        }
        return patterns;
    }

    private long countByStatus(JobStatus status) {
        return jobs.values().stream().filter(job -> job.getStatus() == status).count();
    }

    private ExecutionJob require(String jobId) {
        ExecutionJob job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    /**
     * Cancel every unfinished job and stop the pool
     */
    @PreDestroy
    public void shutdown() {
        log.info("Shutting down job manager");
        jobs.values().stream()
            .filter(job -> job.getStatus().isCancellable())
            .forEach(job -> cancel(job.getJobId()));
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Execution pool did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Pool entry for one job; higher priority first, then submission order
     */
    private final class JobTask implements Runnable, Comparable<JobTask> {

        private final ExecutionJob job;
        private final JobExecutor executor;
        private final long seq;

        JobTask(ExecutionJob job, JobExecutor executor, long seq) {
            this.job = job;
            this.executor = executor;
            this.seq = seq;
        }

        @Override
        public int compareTo(JobTask other) {
            int byPriority = Integer.compare(other.job.getPriority().getWeight(), job.getPriority().getWeight());
            return byPriority != 0 ? byPriority : Long.compare(seq, other.seq);
        }

        @Override
        public void run() {
            String jobId = job.getJobId();
            if (!job.attachRunner(Thread.currentThread())) {
                log.info("Job {} skipped: {} before it got a pool slot", jobId, job.getStatus());
                return;
            }
            Timer.Sample sample = Timer.start(meterRegistry);
            try {
                JobResult result = executor.execute(job);
                if (job.isCancellationRequested()) {
                    log.info("Job {} returned after {}, result discarded", jobId, job.getStatus());
                } else if (job.complete(result, clock.instant())) {
                    completedCounter.increment();
                    log.info("Job {} status updated: COMPLETED", jobId);
                }
            } catch (DispatchFailedException e) {
                fail(e.getMessage(), e.getResult().toJobResult());
            } catch (Exception e) {
                if (job.isCancellationRequested()) {
                    log.info("Job {} stopped after {}: {}", jobId, job.getStatus(), e.toString());
                } else {
                    log.error("Job {} failed", jobId, e);
                    fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), null);
                }
            } catch (Error e) {
                log.error("Job {} failed with {}", jobId, e.getClass().getName(), e);
                fail(e.getMessage() != null ? e.getClass().getSimpleName() + ": " + e.getMessage()
                    : e.getClass().getSimpleName(), null);
                if (e instanceof VirtualMachineError) {
                    throw e;
                }
            } finally {
                sample.stop(executionTimer);
                job.detachRunner();
                // a cancel may have interrupted this thread; it must not leak into the next job
                Thread.interrupted();
            }
        }

        private void fail(String message, JobResult result) {
            if (job.fail(message, result, clock.instant())) {
                failedCounter.increment();
                log.info("Job {} status updated: FAILED ({})", job.getJobId(), message);
            }
        }
    }
}
