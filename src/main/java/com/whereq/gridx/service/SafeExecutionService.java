package com.whereq.gridx.service;

import com.whereq.gridx.analysis.AnalysisReport;
import com.whereq.gridx.analysis.AnalyzerRegistry;
import com.whereq.gridx.dto.SafeExecuteRequest;
import com.whereq.gridx.dto.SafeExecuteResponse;
import com.whereq.gridx.exception.AnalysisRejectedException;
import com.whereq.gridx.executor.RemoteJobExecutor;
import com.whereq.gridx.model.JobSnapshot;
import com.whereq.gridx.service.AdmissionController.AdmissionDecision;
import com.whereq.gridx.worker.WorkerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Service for analyzed code submission
 */
@Slf4j
@Service
public class SafeExecutionService {

    @Autowired
    private AnalyzerRegistry analyzerRegistry;

    @Autowired
    private AdmissionController admissionController;

    @Autowired
    private JobManager jobManager;

    @Autowired
    private RemoteJobExecutor remoteJobExecutor;

    @Autowired
    private WorkerRegistry workerRegistry;

    public AnalysisReport analyze(String language, String code) {
        return analyzerRegistry.analyze(language, code);
    }

    /**
     * Analyze, admit, create and schedule a job
     *
     * @param request submission
     * @return submission response with the job id
     * @throws AnalysisRejectedException when a high severity issue was found
     *         and the caller did not allow risky code
     */
    public SafeExecuteResponse submit(SafeExecuteRequest request) {
        AnalysisReport report = analyzerRegistry.analyze(request.getLanguage(), request.getCode());
        AdmissionDecision decision = admissionController.decide(report, request.isAllowRisky());
        if (decision == AdmissionDecision.REJECT) {
            throw new AnalysisRejectedException(report);
        }
        String worker = request.getWorker() != null && !request.getWorker().isBlank() ? request.getWorker() : null;
        if (worker != null) {
            // fail fast instead of creating a job doomed to WORKER_NOT_FOUND
            workerRegistry.get(worker);
        }

        Duration timeout = request.getTimeout() != null ? Duration.ofSeconds(request.getTimeout()) : null;
        String jobId = jobManager.create(request.getCode(), worker, request.getUserId(),
            request.getPriority(), timeout);
        jobManager.recordAnalysis(jobId, report);
        jobManager.submit(jobId, remoteJobExecutor);

        JobSnapshot job = jobManager.requireJob(jobId);
        log.info("Job {} submitted ({})", jobId, decision);
        return SafeExecuteResponse.builder()
            .jobId(jobId)
            .status(job.getStatus())
            .decision(decision)
            .analysis(report)
            .submittedAt(job.getCreatedAt())
            .message(decision == AdmissionDecision.ADMIT_WITH_OVERRIDE
                ? "Submitted despite high severity issues"
                : "Submitted")
            .build();
    }
}
