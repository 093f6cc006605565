package com.whereq.gridx.controller;

import com.whereq.gridx.dto.BatchExecRequest;
import com.whereq.gridx.dto.BestWorkerResponse;
import com.whereq.gridx.dto.ExecRequest;
import com.whereq.gridx.dto.OnlineWorkersResponse;
import com.whereq.gridx.executor.DispatchResult;
import com.whereq.gridx.executor.ExecDispatcher;
import com.whereq.gridx.model.WorkerHealth;
import com.whereq.gridx.observability.RequestLoggingFilter;
import com.whereq.gridx.worker.WorkerSelector;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Controller for direct command execution on workers
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/exec")
@Tag(name = "Exec", description = "Direct command execution and worker selection")
public class ExecController {

    static final String SELECTION_REASON = "Selected based on lowest load and resource availability";

    @Autowired
    private ExecDispatcher dispatcher;

    @Autowired
    private WorkerSelector selector;

    /**
     * Run a command on the named worker, or on the best one when none is named
     */
    @PostMapping
    @Operation(summary = "Execute command", description = "Run a shell command on a worker")
    public Mono<ResponseEntity<Object>> exec(@Valid @RequestBody ExecRequest request, ServerWebExchange exchange) {
        Duration timeout = seconds(request.getTimeout());
        Mono<DispatchResult> result = request.getWorker() != null && !request.getWorker().isBlank()
            ? dispatcher.dispatch(request.getWorker(), request.getCommand(), timeout)
            : dispatcher.dispatchToBest(request.getCommand(), timeout);
        return result.map(dispatched -> respond(dispatched, exchange));
    }

    @PostMapping("/auto")
    @Operation(summary = "Execute on best worker", description = "Run a shell command on the least loaded worker")
    public Mono<ResponseEntity<Object>> execAuto(@RequestParam String command,
                                                 @RequestParam(required = false) Integer timeout,
                                                 ServerWebExchange exchange) {
        if (command.isBlank()) {
            return Responses.error(HttpStatus.BAD_REQUEST, "Command is required");
        }
        return dispatcher.dispatchToBest(command, seconds(timeout))
            .map(dispatched -> respond(dispatched, exchange));
    }

    @PostMapping("/batch")
    @Operation(summary = "Batch execute", description = "Run one command on several workers concurrently")
    public Mono<ResponseEntity<Object>> batch(@Valid @RequestBody BatchExecRequest request) {
        log.info("Batch request for workers {}", request.getWorkers());
        return dispatcher.batchDispatch(request.getWorkers(), request.getCommand(), seconds(request.getTimeout()))
            .map(Responses::ok)
            .onErrorResume(IllegalArgumentException.class, e -> Responses.error(HttpStatus.BAD_REQUEST, e.getMessage()));
    }

    @GetMapping("/workers/best")
    @Operation(summary = "Best worker", description = "The worker auto-selection would pick right now")
    public Mono<ResponseEntity<Object>> bestWorker() {
        return selector.selectBest()
            .map(best -> Responses.ok(new BestWorkerResponse(best.getName(), best.getWorker(),
                best.getStatus(), SELECTION_REASON)))
            .switchIfEmpty(Responses.error(HttpStatus.SERVICE_UNAVAILABLE, "No workers available"));
    }

    @GetMapping("/workers/online")
    @Operation(summary = "Eligible workers",
        description = "Workers that answer their liveness probe and report telemetry, least loaded first")
    public Mono<ResponseEntity<OnlineWorkersResponse>> onlineWorkers() {
        return selector.rankEligible()
            .map(ranked -> ranked.stream().map(WorkerHealth::getName).toList())
            .map(names -> ResponseEntity.ok(new OnlineWorkersResponse(names)));
    }

    static ResponseEntity<Object> respond(DispatchResult result, ServerWebExchange exchange) {
        if (result.getWorker() != null) {
            exchange.getAttributes().put(RequestLoggingFilter.WORKER_ATTRIBUTE, result.getWorker());
        }
        return switch (result.getOutcome()) {
            case WORKER_NOT_FOUND -> Responses.status(HttpStatus.NOT_FOUND, result);
            case NO_ELIGIBLE_WORKER -> Responses.status(HttpStatus.SERVICE_UNAVAILABLE, result);
            default -> Responses.ok(result);
        };
    }

    private static Duration seconds(Integer timeout) {
        return timeout != null ? Duration.ofSeconds(timeout) : null;
    }
}
