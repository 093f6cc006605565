package com.whereq.gridx.worker;

import com.whereq.gridx.config.GridxProperties;
import com.whereq.gridx.model.Worker;
import com.whereq.gridx.model.WorkerStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * HTTP client for the agent running on every worker
 * ({@code GET /ping}, {@code GET /status}, {@code POST /exec}).
 */
@Slf4j
@Component
public class WorkerAgentClient {

    private final WebClient webClient;
    private final GridxProperties.WorkersConfig config;

    public WorkerAgentClient(WebClient.Builder webClientBuilder, GridxProperties properties) {
        this.webClient = webClientBuilder.build();
        this.config = properties.getWorkers();
    }

    /**
     * Liveness probe. Never errors: an unreachable agent yields {@code false}.
     */
    public Mono<Boolean> ping(Worker worker) {
        return webClient.get()
            .uri(baseUrl(worker) + "/ping")
            .retrieve()
            .toBodilessEntity()
            .timeout(config.getPingTimeout())
            .map(response -> response.getStatusCode().is2xxSuccessful())
            .onErrorResume(e -> {
                log.debug("Ping to worker {} ({}) failed: {}", worker.getName(), worker.getIp(), e.toString());
                return Mono.just(false);
            });
    }

    /**
     * Telemetry of the worker; errors when the agent is unreachable or
     * answers with an error status
     */
    public Mono<WorkerStatus> status(Worker worker) {
        return webClient.get()
            .uri(baseUrl(worker) + "/status")
            .retrieve()
            .bodyToMono(WorkerStatus.class)
            .timeout(config.getStatusTimeout())
            .doOnError(e -> log.debug("Status of worker {} unavailable: {}", worker.getName(), e.toString()));
    }

    /**
     * Run a shell command on the worker. Transport errors, HTTP error
     * statuses and the timeout surface as error signals.
     */
    public Mono<AgentExecResponse> exec(Worker worker, String command, Duration timeout) {
        return webClient.post()
            .uri(baseUrl(worker) + "/exec")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("cmd", command))
            .retrieve()
            .bodyToMono(AgentExecResponse.class)
            .timeout(timeout);
    }

    String baseUrl(Worker worker) {
        return "http://" + worker.getIp() + ":" + config.getAgentPort();
    }
}
