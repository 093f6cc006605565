package com.whereq.gridx.executor;

import com.whereq.gridx.config.GridxProperties;
import com.whereq.gridx.executor.DispatchResult.Outcome;
import com.whereq.gridx.model.Worker;
import com.whereq.gridx.worker.WorkerAgentClient;
import com.whereq.gridx.worker.WorkerRegistry;
import com.whereq.gridx.worker.WorkerSelector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Routes commands to worker agents.
 * <p>
 * All methods complete normally: every failure is folded into a
 * {@link DispatchResult} with a distinct {@link Outcome}.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class ExecDispatcher {

    public static final String ALL_WORKERS = "all";

    private final WorkerRegistry registry;
    private final WorkerSelector selector;
    private final WorkerAgentClient agentClient;
    private final GridxProperties.DispatchConfig config;
    private final Clock clock;

    public ExecDispatcher(WorkerRegistry registry, WorkerSelector selector, WorkerAgentClient agentClient,
                          GridxProperties properties, Clock clock) {
        this.registry = registry;
        this.selector = selector;
        this.agentClient = agentClient;
        this.config = properties.getDispatch();
        this.clock = clock;
    }

    /**
     * Caller supplied timeout, defaulted and capped at the agent's ceiling
     */
    public Duration effectiveTimeout(Duration requested) {
        if (requested == null || requested.isZero() || requested.isNegative()) {
            return config.getDefaultTimeout();
        }
        return requested.compareTo(config.getMaxTimeout()) > 0 ? config.getMaxTimeout() : requested;
    }

    public Mono<DispatchResult> dispatch(String workerName, String command, Duration timeout) {
        return registry.find(workerName)
            .map(worker -> dispatch(worker, command, timeout))
            .orElseGet(() -> Mono.fromSupplier(() -> {
                log.warn("Dispatch to unknown worker {}", workerName);
                return DispatchResult.failure(Outcome.WORKER_NOT_FOUND, workerName, command,
                    "Worker not found", 0, clock.instant());
            }));
    }

    public Mono<DispatchResult> dispatch(Worker worker, String command, Duration timeout) {
        Duration effective = effectiveTimeout(timeout);
        return Mono.defer(() -> {
            long start = clock.millis();
            log.info("Dispatching command to worker {} (timeout {}s)", worker.getName(), effective.toSeconds());
            return agentClient.exec(worker, command, effective)
                .map(response -> {
                    int exitCode = response.getExitCode() != null ? response.getExitCode() : 1;
                    return DispatchResult.success(worker.getName(), command, response.getOutput(),
                        response.getError(), exitCode, clock.millis() - start, clock.instant());
                })
                .switchIfEmpty(Mono.fromSupplier(() -> DispatchResult.failure(Outcome.REMOTE_ERROR,
                    worker.getName(), command, "Empty response from worker agent",
                    clock.millis() - start, clock.instant())))
                .onErrorResume(e -> Mono.just(DispatchResult.failure(classify(e), worker.getName(), command,
                    failureMessage(e, effective), clock.millis() - start, clock.instant())))
                .doOnNext(result -> log.info("Worker {} finished with {} in {}ms",
                    worker.getName(), result.getOutcome(), result.getExecutionTimeMs()));
        });
    }

    /**
     * Run on the best live worker, or fail with NO_ELIGIBLE_WORKER
     */
    public Mono<DispatchResult> dispatchToBest(String command, Duration timeout) {
        return selector.selectBest()
            .flatMap(best -> dispatch(best.getWorker(), command, timeout))
            .map(DispatchResult::asAutoSelected)
            .switchIfEmpty(Mono.fromSupplier(() -> DispatchResult.failure(Outcome.NO_ELIGIBLE_WORKER,
                null, command, "No workers available", 0, clock.instant())));
    }

    /**
     * Same command on several workers concurrently. {@value #ALL_WORKERS}
     * expands to every registered worker; one worker's failure never
     * affects the others.
     *
     * Errors with {@link IllegalArgumentException} when no worker is named.
     */
    public Mono<BatchDispatchResult> batchDispatch(List<String> workers, String command, Duration timeout) {
        Set<String> targets = new LinkedHashSet<>();
        if (workers != null && workers.contains(ALL_WORKERS)) {
            registry.snapshot().forEach(worker -> targets.add(worker.getName()));
        } else if (workers != null) {
            targets.addAll(workers);
        }
        if (targets.isEmpty()) {
            return Mono.error(new IllegalArgumentException("No workers specified"));
        }
        log.info("Batch dispatch to {} worker(s)", targets.size());

        return Flux.fromIterable(targets)
            .flatMap(name -> dispatch(name, command, timeout).map(result -> Map.entry(name, result)))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue)
            .map(collected -> {
                Map<String, DispatchResult> ordered = new LinkedHashMap<>();
                targets.forEach(name -> ordered.put(name, collected.get(name)));
                return new BatchDispatchResult(ordered);
            });
    }

    static Outcome classify(Throwable error) {
        if (error instanceof TimeoutException) {
            return Outcome.TIMEOUT;
        }
        if (error instanceof WebClientResponseException response) {
            return response.getStatusCode().value() == HttpStatus.REQUEST_TIMEOUT.value()
                ? Outcome.TIMEOUT
                : Outcome.REMOTE_ERROR;
        }
        if (error instanceof WebClientRequestException) {
            for (Throwable cause = error.getCause(); cause != null; cause = cause.getCause()) {
                if (cause instanceof SocketTimeoutException || cause instanceof TimeoutException) {
                    return Outcome.TIMEOUT;
                }
            }
            return Outcome.CONNECTION_ERROR;
        }
        return Outcome.REMOTE_ERROR;
    }

    private static String failureMessage(Throwable error, Duration timeout) {
        if (error instanceof TimeoutException) {
            return "Timeout after " + timeout.toSeconds() + "s";
        }
        if (error instanceof WebClientResponseException response) {
            String body = response.getResponseBodyAsString();
            return "HTTP " + response.getStatusCode().value() + (body.isBlank() ? "" : ": " + body);
        }
        if (error instanceof WebClientRequestException) {
            Throwable root = error;
            while (root.getCause() != null) {
                root = root.getCause();
            }
            return "Cannot connect: " + root.getMessage();
        }
        return error.getMessage();
    }
}
