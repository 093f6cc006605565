package com.whereq.gridx.dto;

import com.whereq.gridx.model.Worker;
import com.whereq.gridx.model.WorkerStatus;
import lombok.Value;

@Value
public class BestWorkerResponse {
    String name;
    Worker info;
    WorkerStatus status;
    String reason;
}
