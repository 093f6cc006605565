package com.whereq.gridx.controller;

import com.whereq.gridx.dto.AnalyzeRequest;
import com.whereq.gridx.dto.CleanupResponse;
import com.whereq.gridx.dto.JobControlRequest;
import com.whereq.gridx.dto.JobControlResponse;
import com.whereq.gridx.dto.JobDetailResponse;
import com.whereq.gridx.dto.JobListResponse;
import com.whereq.gridx.dto.JobSummary;
import com.whereq.gridx.dto.SafeExecuteRequest;
import com.whereq.gridx.dto.SafeExecuteResponse;
import com.whereq.gridx.exception.AnalysisRejectedException;
import com.whereq.gridx.exception.InvalidTransitionException;
import com.whereq.gridx.exception.JobNotFoundException;
import com.whereq.gridx.exception.WorkerNotFoundException;
import com.whereq.gridx.model.JobSnapshot;
import com.whereq.gridx.service.JobManager;
import com.whereq.gridx.service.SafeExecutionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Controller for analyzed code submission and job management
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/exec")
@Tag(name = "Jobs", description = "Static analysis, safe execution and job control")
public class ExecJobController {

    private static final String CANCEL = "cancel";

    @Autowired
    private SafeExecutionService safeExecutionService;

    @Autowired
    private JobManager jobManager;

    @PostMapping("/analyze")
    @Operation(summary = "Analyze code", description = "Run static analysis only, nothing is executed")
    public Mono<ResponseEntity<Object>> analyze(@Valid @RequestBody AnalyzeRequest request) {
        return Mono.fromCallable(() -> safeExecutionService.analyze(request.getLanguage(), request.getCode()))
            .subscribeOn(Schedulers.boundedElastic())
            .map(Responses::ok)
            .onErrorResume(IllegalArgumentException.class, e -> Responses.error(HttpStatus.BAD_REQUEST, e.getMessage()));
    }

    /**
     * Analyze the code and, when admitted, queue it as a job
     *
     * @param request submission
     * @return 202 with the job id, or 422 with the analysis when rejected
     */
    @PostMapping("/safe-execute")
    @Operation(summary = "Safe execute", description = "Analyze code and run it on a worker when admitted")
    public Mono<ResponseEntity<Object>> safeExecute(@Valid @RequestBody SafeExecuteRequest request) {
        log.info("Received safe-execute request from user {} (worker={}, allowRisky={})",
            request.getUserId(), request.getWorker(), request.isAllowRisky());

        return Mono.fromCallable(() -> safeExecutionService.submit(request))
            .subscribeOn(Schedulers.boundedElastic())
            .map(response -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create("/exec/jobs/" + response.getJobId()))
                .<Object>body(response))
            .onErrorResume(AnalysisRejectedException.class, e -> {
                log.warn("Submission rejected: {}", e.getMessage());
                return Mono.just(Responses.status(HttpStatus.UNPROCESSABLE_ENTITY,
                    SafeExecuteResponse.rejected(e.getReport(), e.getMessage())));
            })
            .onErrorResume(WorkerNotFoundException.class, e -> Responses.error(HttpStatus.NOT_FOUND, e.getMessage()))
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.error("Validation error: {}", e.getMessage());
                return Responses.error(HttpStatus.BAD_REQUEST, e.getMessage());
            });
    }

    @GetMapping("/jobs")
    @Operation(summary = "List jobs", description = "All jobs, newest first, optionally for one user")
    public Mono<ResponseEntity<JobListResponse>> listJobs(
            @RequestParam(value = "user_id", required = false) String userId) {
        List<JobSnapshot> jobs = userId != null && !userId.isBlank()
            ? jobManager.getUserJobs(userId)
            : jobManager.getJobs();
        return Mono.just(ResponseEntity.ok(new JobListResponse(jobs.stream().map(JobSummary::from).toList())));
    }

    @GetMapping("/jobs/stats")
    @Operation(summary = "Job statistics")
    public Mono<ResponseEntity<Object>> stats() {
        return Mono.fromCallable(jobManager::stats)
            .map(Responses::ok);
    }

    @GetMapping("/jobs/{jobId}")
    @Operation(summary = "Job detail", description = "Full job including result, analysis and metrics")
    public Mono<ResponseEntity<Object>> getJob(@PathVariable String jobId) {
        return Mono.fromCallable(() -> jobManager.requireJob(jobId))
            .map(job -> Responses.ok(new JobDetailResponse(job, jobManager.detectSuspiciousPatterns(job))))
            .onErrorResume(JobNotFoundException.class, e -> Responses.error(HttpStatus.NOT_FOUND, e.getMessage()));
    }

    @PostMapping("/jobs/{jobId}/control")
    @Operation(summary = "Control job", description = "Apply an action to a job; only cancel is supported")
    public Mono<ResponseEntity<Object>> controlJob(@PathVariable String jobId,
                                                   @Valid @RequestBody JobControlRequest request) {
        String action = request.getAction().trim().toLowerCase(Locale.ROOT);
        if (!CANCEL.equals(action)) {
            return Responses.error(HttpStatus.BAD_REQUEST, "Unknown action: " + request.getAction());
        }

        return Mono.fromCallable(() -> jobManager.cancelJob(jobId))
            .map(job -> Responses.ok(JobControlResponse.builder()
                .jobId(jobId)
                .action(action)
                .success(true)
                .status(job.getStatus())
                .cancelledAt(job.getCompletedAt())
                .message("Job cancelled")
                .build()))
            .onErrorResume(JobNotFoundException.class, e -> Responses.error(HttpStatus.NOT_FOUND, e.getMessage()))
            .onErrorResume(InvalidTransitionException.class, e -> Mono.just(Responses.status(HttpStatus.CONFLICT,
                JobControlResponse.builder()
                    .jobId(jobId)
                    .action(action)
                    .success(false)
                    .status(jobManager.getJob(jobId).map(JobSnapshot::getStatus).orElse(null))
                    .message(e.getMessage())
                    .build())));
    }

    @DeleteMapping("/jobs/cleanup")
    @Operation(summary = "Clean up jobs", description = "Remove terminal jobs older than the given age")
    public Mono<ResponseEntity<Object>> cleanup(
            @RequestParam(value = "max_age_hours", defaultValue = "24") double maxAgeHours) {
        if (maxAgeHours < 0 || Double.isNaN(maxAgeHours)) {
            return Responses.error(HttpStatus.BAD_REQUEST, "max_age_hours must not be negative");
        }
        Duration maxAge = Duration.ofMillis(Math.round(maxAgeHours * 3_600_000));
        return Mono.fromCallable(() -> jobManager.cleanup(maxAge))
            .map(removed -> Responses.ok(new CleanupResponse(removed, maxAgeHours)));
    }
}
