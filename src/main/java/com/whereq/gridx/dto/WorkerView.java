package com.whereq.gridx.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.gridx.model.Worker;
import com.whereq.gridx.model.WorkerHealth;
import com.whereq.gridx.model.WorkerStatus;
import lombok.Builder;
import lombok.Value;

/**
 * A registered worker together with its probe result
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkerView {
    String name;
    String ip;
    Integer cpus;
    String memory;
    int gpus;
    boolean online;

    /**
     * "active" or "inactive"; only set in pool views
     */
    String state;

    /**
     * Agent telemetry, null when offline or not probed
     */
    WorkerStatus status;

    public static WorkerView of(Worker worker, boolean online) {
        return WorkerView.builder()
            .name(worker.getName())
            .ip(worker.getIp())
            .cpus(worker.getCpus())
            .memory(worker.getMemory())
            .gpus(worker.getGpus())
            .online(online)
            .build();
    }

    public static WorkerView of(WorkerHealth health) {
        return of(health.getWorker(), health.isOnline()).toBuilder()
            .state(health.isOnline() ? "active" : "inactive")
            .status(health.getStatus())
            .build();
    }
}
