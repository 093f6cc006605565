package com.whereq.gridx.controller;

import com.whereq.gridx.worker.WorkerRegistry;
import com.whereq.gridx.worker.WorkerSelector;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller to verify the service and worker reachability.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/health")
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    @Autowired
    private WorkerRegistry workerRegistry;

    @Autowired
    private WorkerSelector workerSelector;

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the service is up and how many workers answer")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        int total = workerRegistry.snapshot().size();
        return workerSelector.onlineWorkers()
            .map(online -> {
                Map<String, Object> health = new HashMap<>();
                health.put("status", "UP");
                health.put("service", "whereq-gridx");

                Map<String, Object> workers = new HashMap<>();
                workers.put("online", online.size());
                workers.put("total", total);
                workers.put("status", online.isEmpty() && total > 0 ? "UNREACHABLE" : "CONNECTED");
                health.put("workers", workers);
                return ResponseEntity.ok(health);
            })
            .onErrorResume(e -> {
                Map<String, Object> health = new HashMap<>();
                health.put("status", "UP");
                health.put("service", "whereq-gridx");

                Map<String, Object> workers = new HashMap<>();
                workers.put("status", "ERROR");
                workers.put("error", e.getMessage());
                health.put("workers", workers);
                return Mono.just(ResponseEntity.ok(health));
            });
    }
}
