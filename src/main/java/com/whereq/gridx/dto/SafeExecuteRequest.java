package com.whereq.gridx.dto;

import com.whereq.gridx.model.JobPriority;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to analyze code and, if admitted, run it as a job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SafeExecuteRequest {

    /**
     * Target worker; the least loaded live worker when omitted
     */
    private String worker;

    @NotBlank(message = "Code is required")
    private String code;

    /**
     * Job timeout in seconds; no timeout when omitted
     */
    @Positive(message = "Timeout must be positive")
    private Integer timeout;

    private JobPriority priority;

    /**
     * Run even when analysis found high severity issues
     */
    private boolean allowRisky;

    private String language;

    private String userId;
}
