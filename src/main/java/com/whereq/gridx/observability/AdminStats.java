package com.whereq.gridx.observability;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.whereq.gridx.model.JobStats;
import lombok.Builder;
import lombok.Value;

/**
 * Admin dashboard view: request totals, job stats and worker availability
 */
@Value
@Builder
public class AdminStats {

    @JsonUnwrapped
    RequestStats requests;

    JobStats jobs;

    int workersOnline;

    int workersTotal;
}
