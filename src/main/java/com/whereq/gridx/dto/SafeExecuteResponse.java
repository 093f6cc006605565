package com.whereq.gridx.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.gridx.analysis.AnalysisReport;
import com.whereq.gridx.model.JobStatus;
import com.whereq.gridx.service.AdmissionController.AdmissionDecision;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for a safe-execute submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SafeExecuteResponse {
    /**
     * Unique job identifier, absent when rejected
     */
    private String jobId;

    /**
     * Job status right after submission
     */
    private JobStatus status;

    private AdmissionDecision decision;

    /**
     * Full analysis, so a rejected caller can remediate or override
     */
    private AnalysisReport analysis;

    private Instant submittedAt;

    private String message;

    /**
     * Create rejection response
     */
    public static SafeExecuteResponse rejected(AnalysisReport analysis, String message) {
        return SafeExecuteResponse.builder()
            .decision(AdmissionDecision.REJECT)
            .analysis(analysis)
            .message(message)
            .build();
    }
}
