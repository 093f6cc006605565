package com.whereq.gridx.model;

import lombok.Value;

/**
 * Liveness and load of one worker at probe time
 */
@Value
public class WorkerHealth {
    Worker worker;

    /**
     * Position in the registry snapshot, used as the final selection tie-break
     */
    int order;

    boolean online;

    /**
     * Null when the worker is offline or its status endpoint failed
     */
    WorkerStatus status;

    String error;

    public String getName() {
        return worker.getName();
    }

    public double combinedLoad() {
        return status != null ? status.combinedLoad() : 0.0;
    }
}
