package com.whereq.gridx.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Per-worker load of the whole pool plus the worker the selector would pick
 */
@Value
@Builder
public class PoolStatus {
    int totalWorkers;
    int onlineWorkers;
    int offlineWorkers;
    Map<String, WorkerView> workers;

    /**
     * Null when no worker is eligible
     */
    String recommendedWorker;
}
