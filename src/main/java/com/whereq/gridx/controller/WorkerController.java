package com.whereq.gridx.controller;

import com.whereq.gridx.dto.ExecRequest;
import com.whereq.gridx.exception.WorkerNotFoundException;
import com.whereq.gridx.executor.ExecDispatcher;
import com.whereq.gridx.worker.WorkerPoolService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Worker inventory, liveness and telemetry
 */
@RestController
@RequestMapping("/workers")
@RequiredArgsConstructor
@Tag(name = "Workers", description = "Registered workers and pool health")
public class WorkerController {

    private final WorkerPoolService poolService;
    private final ExecDispatcher dispatcher;

    @GetMapping
    @Operation(summary = "List workers", description = "Registered workers with their online flag")
    public Mono<ResponseEntity<Object>> listWorkers() {
        return poolService.listWorkers().map(workers -> {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("workers", workers);
            body.put("count", workers.size());
            return Responses.ok(body);
        });
    }

    @GetMapping("/ping")
    @Operation(summary = "Ping all workers")
    public Mono<ResponseEntity<Object>> pingAll() {
        return poolService.pingAll().map(Responses::ok);
    }

    @GetMapping("/pool/status")
    @Operation(summary = "Pool status", description = "Per-worker load and the recommended worker")
    public Mono<ResponseEntity<Object>> poolStatus() {
        return poolService.poolStatus().map(Responses::ok);
    }

    @GetMapping("/pool/health")
    @Operation(summary = "Pool health", description = "Health grade derived from the share of online workers")
    public Mono<ResponseEntity<Object>> poolHealth() {
        return poolService.poolHealth().map(Responses::ok);
    }

    @GetMapping("/{name}")
    @Operation(summary = "Worker detail")
    public Mono<ResponseEntity<Object>> getWorker(@PathVariable String name) {
        return poolService.describe(name)
            .map(Responses::ok)
            .onErrorResume(WorkerNotFoundException.class, e -> Responses.error(HttpStatus.NOT_FOUND, e.getMessage()));
    }

    @GetMapping("/{name}/ping")
    @Operation(summary = "Ping worker")
    public Mono<ResponseEntity<Object>> ping(@PathVariable String name) {
        return poolService.ping(name)
            .map(online -> {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("name", name);
                body.put("online", online);
                return Responses.ok(body);
            })
            .onErrorResume(WorkerNotFoundException.class, e -> Responses.error(HttpStatus.NOT_FOUND, e.getMessage()));
    }

    @GetMapping("/{name}/status")
    @Operation(summary = "Worker telemetry", description = "Status reported by the worker agent")
    public Mono<ResponseEntity<Object>> status(@PathVariable String name) {
        return poolService.status(name)
            .map(Responses::ok)
            .switchIfEmpty(Mono.defer(() -> Responses.error(HttpStatus.SERVICE_UNAVAILABLE,
                "Worker '" + name + "' is offline or unreachable")))
            .onErrorResume(WorkerNotFoundException.class, e -> Responses.error(HttpStatus.NOT_FOUND, e.getMessage()));
    }

    @PostMapping("/{name}/exec")
    @Operation(summary = "Execute on worker", description = "Run a shell command on the named worker")
    public Mono<ResponseEntity<Object>> exec(@PathVariable String name,
                                             @Valid @RequestBody ExecRequest request,
                                             ServerWebExchange exchange) {
        Duration timeout = request.getTimeout() != null ? Duration.ofSeconds(request.getTimeout()) : null;
        return dispatcher.dispatch(name, request.getCommand(), timeout)
            .map(result -> ExecController.respond(result, exchange));
    }
}
