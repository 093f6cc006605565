package com.whereq.gridx.dto;

import lombok.Value;

import java.util.List;

@Value
public class JobListResponse {
    List<JobSummary> jobs;

    public int getCount() {
        return jobs.size();
    }
}
