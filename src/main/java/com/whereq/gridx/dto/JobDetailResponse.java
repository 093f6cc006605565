package com.whereq.gridx.dto;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.whereq.gridx.model.JobSnapshot;
import lombok.Value;

import java.util.List;

/**
 * Response for job detail query: the full job plus runaway warnings
 */
@Value
public class JobDetailResponse {

    @JsonUnwrapped
    JobSnapshot job;

    /**
     * e.g. sustained_high_cpu, high_memory_usage, long_execution_no_progress
     */
    List<String> warnings;
}
