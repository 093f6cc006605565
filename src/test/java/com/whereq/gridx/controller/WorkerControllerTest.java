package com.whereq.gridx.controller;

import com.whereq.gridx.dto.PingSummary;
import com.whereq.gridx.dto.PoolHealth;
import com.whereq.gridx.dto.PoolStatus;
import com.whereq.gridx.dto.WorkerView;
import com.whereq.gridx.exception.WorkerNotFoundException;
import com.whereq.gridx.executor.DispatchResult;
import com.whereq.gridx.executor.ExecDispatcher;
import com.whereq.gridx.model.Worker;
import com.whereq.gridx.model.WorkerStatus;
import com.whereq.gridx.support.WebLayerTestConfig;
import com.whereq.gridx.worker.WorkerPoolService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;

@WebFluxTest(controllers = WorkerController.class)
@Import(WebLayerTestConfig.class)
class WorkerControllerTest {

    private static final Worker W1 = Worker.builder().name("w1").ip("10.0.0.1").cpus(8).memory("32GB").build();

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private WorkerPoolService poolService;

    @MockBean
    private ExecDispatcher dispatcher;

    @Test
    void listWorkers() {
        when(poolService.listWorkers()).thenReturn(Mono.just(List.of(WorkerView.of(W1, true))));

        webTestClient.get().uri("/workers")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.count").isEqualTo(1)
            .jsonPath("$.workers[0].name").isEqualTo("w1")
            .jsonPath("$.workers[0].online").isEqualTo(true)
            .jsonPath("$.workers[0].state").doesNotExist();
    }

    @Test
    void pingAll() {
        Map<String, Boolean> workers = new LinkedHashMap<>();
        workers.put("w1", true);
        workers.put("w2", false);
        when(poolService.pingAll()).thenReturn(Mono.just(new PingSummary(workers)));

        webTestClient.get().uri("/workers/ping")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.workers.w2").isEqualTo(false)
            .jsonPath("$.online").isEqualTo(1)
            .jsonPath("$.offline").isEqualTo(1)
            .jsonPath("$.total").isEqualTo(2);
    }

    @Test
    void poolStatusAndHealth() {
        when(poolService.poolStatus()).thenReturn(Mono.just(PoolStatus.builder()
            .totalWorkers(1)
            .onlineWorkers(1)
            .workers(Map.of("w1", WorkerView.of(W1, true)))
            .recommendedWorker("w1")
            .build()));
        when(poolService.poolHealth()).thenReturn(Mono.just(PoolHealth.of(List.of("w1"), 2)));

        webTestClient.get().uri("/workers/pool/status")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.recommended_worker").isEqualTo("w1")
            .jsonPath("$.workers.w1.ip").isEqualTo("10.0.0.1");

        webTestClient.get().uri("/workers/pool/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.health_status").isEqualTo("fair")
            .jsonPath("$.health_score").isEqualTo(60)
            .jsonPath("$.availability_percentage").isEqualTo(50.0)
            .jsonPath("$.online_worker_names[0]").isEqualTo("w1");
    }

    @Test
    void unknownWorkerIsNotFound() {
        when(poolService.describe("ghost")).thenReturn(Mono.error(new WorkerNotFoundException("ghost")));
        when(poolService.ping("ghost")).thenReturn(Mono.error(new WorkerNotFoundException("ghost")));

        webTestClient.get().uri("/workers/ghost")
            .exchange()
            .expectStatus().isNotFound()
            .expectBody()
            .jsonPath("$.error").isEqualTo("Worker 'ghost' not found");

        webTestClient.get().uri("/workers/ghost/ping")
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    void pingOneWorker() {
        when(poolService.ping("w1")).thenReturn(Mono.just(false));

        webTestClient.get().uri("/workers/w1/ping")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.name").isEqualTo("w1")
            .jsonPath("$.online").isEqualTo(false);
    }

    @Test
    void statusOfReachableWorker() {
        WorkerStatus status = WorkerStatus.builder().cpuCount(8).cpuPercent(12.5).hostname("w1-host").build();
        status.putDetail("gpu_count", 2);
        when(poolService.status("w1")).thenReturn(Mono.just(status));

        webTestClient.get().uri("/workers/w1/status")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.cpu_count").isEqualTo(8)
            .jsonPath("$.hostname").isEqualTo("w1-host")
            .jsonPath("$.gpu_count").isEqualTo(2);
    }

    @Test
    void statusOfOfflineWorkerIsUnavailable() {
        when(poolService.status("w1")).thenReturn(Mono.empty());

        webTestClient.get().uri("/workers/w1/status")
            .exchange()
            .expectStatus().isEqualTo(503)
            .expectBody()
            .jsonPath("$.error").isEqualTo("Worker 'w1' is offline or unreachable");
    }

    @Test
    void execOnNamedWorker() {
        when(dispatcher.dispatch("w1", "nvidia-smi", Duration.ofSeconds(20))).thenReturn(Mono.just(
            DispatchResult.success("w1", "nvidia-smi", "", "not found", 127, 8,
                Instant.parse(WebLayerTestConfig.NOW))));

        webTestClient.post().uri("/workers/w1/exec")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("command", "nvidia-smi", "timeout", 20))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.outcome").isEqualTo("remote_non_zero_exit")
            .jsonPath("$.exit_code").isEqualTo(127);
    }
}
