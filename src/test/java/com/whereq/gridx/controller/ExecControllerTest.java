package com.whereq.gridx.controller;

import com.whereq.gridx.executor.BatchDispatchResult;
import com.whereq.gridx.executor.DispatchResult;
import com.whereq.gridx.executor.DispatchResult.Outcome;
import com.whereq.gridx.executor.ExecDispatcher;
import com.whereq.gridx.model.Worker;
import com.whereq.gridx.model.WorkerHealth;
import com.whereq.gridx.model.WorkerStatus;
import com.whereq.gridx.observability.RequestLoggingFilter;
import com.whereq.gridx.support.WebLayerTestConfig;
import com.whereq.gridx.worker.WorkerSelector;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = ExecController.class)
@Import(WebLayerTestConfig.class)
class ExecControllerTest {

    private static final Instant NOW = Instant.parse(WebLayerTestConfig.NOW);

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private ExecDispatcher dispatcher;

    @MockBean
    private WorkerSelector selector;

    private static DispatchResult ok(String worker, String command) {
        return DispatchResult.success(worker, command, worker + "\n", "", 0, 15, NOW);
    }

    @Test
    void namedWorkerExecution() {
        when(dispatcher.dispatch("w1", "hostname", Duration.ofSeconds(10)))
            .thenReturn(Mono.just(ok("w1", "hostname")));

        webTestClient.post().uri("/exec")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("worker", "w1", "command", "hostname", "timeout", 10))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.outcome").isEqualTo("success")
            .jsonPath("$.worker").isEqualTo("w1")
            .jsonPath("$.exit_code").isEqualTo(0)
            .jsonPath("$.auto_selected").isEqualTo(false);
    }

    @Test
    void respondTagsTheExchangeWithTheWorker() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/exec"));

        ExecController.respond(ok("w1", "hostname"), exchange);

        assertThat(exchange.<String>getAttribute(RequestLoggingFilter.WORKER_ATTRIBUTE)).isEqualTo("w1");
    }

    @Test
    void withoutWorkerTheBestOneIsUsed() {
        when(dispatcher.dispatchToBest(eq("uptime"), isNull()))
            .thenReturn(Mono.just(ok("w2", "uptime").asAutoSelected()));

        webTestClient.post().uri("/exec")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("command", "uptime"))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.worker").isEqualTo("w2")
            .jsonPath("$.auto_selected").isEqualTo(true);
    }

    @Test
    void unknownWorkerIsNotFound() {
        when(dispatcher.dispatch(eq("ghost"), eq("hostname"), any())).thenReturn(Mono.just(
            DispatchResult.failure(Outcome.WORKER_NOT_FOUND, "ghost", "hostname", "Worker not found", 0, NOW)));

        webTestClient.post().uri("/exec")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("worker", "ghost", "command", "hostname"))
            .exchange()
            .expectStatus().isNotFound()
            .expectBody()
            .jsonPath("$.outcome").isEqualTo("worker_not_found");
    }

    @Test
    void failedCommandIsStillOk() {
        when(dispatcher.dispatch(eq("w1"), eq("hostname"), any())).thenReturn(Mono.just(
            DispatchResult.failure(Outcome.CONNECTION_ERROR, "w1", "hostname", "Cannot connect: refused", 4, NOW)));

        webTestClient.post().uri("/exec")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("worker", "w1", "command", "hostname"))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.outcome").isEqualTo("connection_error")
            .jsonPath("$.error").isEqualTo("Cannot connect: refused");
    }

    @Test
    void autoWithoutLiveWorkersIsUnavailable() {
        when(dispatcher.dispatchToBest(eq("hostname"), any())).thenReturn(Mono.just(
            DispatchResult.failure(Outcome.NO_ELIGIBLE_WORKER, null, "hostname", "No workers available", 0, NOW)));

        webTestClient.post().uri("/exec/auto?command=hostname")
            .exchange()
            .expectStatus().isEqualTo(503)
            .expectBody()
            .jsonPath("$.outcome").isEqualTo("no_eligible_worker");
    }

    @Test
    void blankCommandIsRejected() {
        webTestClient.post().uri("/exec")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("worker", "w1", "command", " "))
            .exchange()
            .expectStatus().isBadRequest();

        webTestClient.post().uri("/exec/auto?command= ")
            .exchange()
            .expectStatus().isBadRequest();

        verify(dispatcher, never()).dispatchToBest(any(), any());
    }

    @Test
    void batchReportsPerWorkerResults() {
        Map<String, DispatchResult> results = new LinkedHashMap<>();
        results.put("w1", ok("w1", "date"));
        results.put("w2", DispatchResult.failure(Outcome.TIMEOUT, "w2", "date", "Timeout after 30s", 30000, NOW));
        when(dispatcher.batchDispatch(List.of("w1", "w2"), "date", null))
            .thenReturn(Mono.just(new BatchDispatchResult(results)));

        webTestClient.post().uri("/exec/batch")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("workers", List.of("w1", "w2"), "command", "date"))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.total").isEqualTo(2)
            .jsonPath("$.success_count").isEqualTo(1)
            .jsonPath("$.results.w2.outcome").isEqualTo("timeout");
    }

    @Test
    void batchWithoutWorkersIsRejected() {
        webTestClient.post().uri("/exec/batch")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("workers", List.of(), "command", "date"))
            .exchange()
            .expectStatus().isBadRequest();

        verify(dispatcher, never()).batchDispatch(anyList(), any(), any());
    }

    @Test
    void bestWorkerExplainsTheChoice() {
        Worker worker = Worker.builder().name("w2").ip("10.0.0.2").gpus(1).build();
        WorkerStatus status = WorkerStatus.builder().cpuPercent(5.0).memoryPercent(10.0).build();
        when(selector.selectBest()).thenReturn(Mono.just(new WorkerHealth(worker, 1, true, status, null)));

        webTestClient.get().uri("/exec/workers/best")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.name").isEqualTo("w2")
            .jsonPath("$.info.ip").isEqualTo("10.0.0.2")
            .jsonPath("$.status.cpu_percent").isEqualTo(5.0)
            .jsonPath("$.reason").isEqualTo("Selected based on lowest load and resource availability");
    }

    @Test
    void noBestWorker() {
        when(selector.selectBest()).thenReturn(Mono.empty());

        webTestClient.get().uri("/exec/workers/best")
            .exchange()
            .expectStatus().isEqualTo(503)
            .expectBody()
            .jsonPath("$.error").isEqualTo("No workers available");
    }

    @Test
    void onlineWorkersListsEligibleWorkersInRankOrder() {
        WorkerStatus idle = WorkerStatus.builder().cpuPercent(5.0).memoryPercent(10.0).build();
        WorkerStatus busy = WorkerStatus.builder().cpuPercent(80.0).memoryPercent(60.0).build();
        WorkerHealth w3 = new WorkerHealth(Worker.builder().name("w3").ip("10.0.0.3").build(), 2, true, idle, null);
        WorkerHealth w1 = new WorkerHealth(Worker.builder().name("w1").ip("10.0.0.1").build(), 0, true, busy, null);
        when(selector.rankEligible()).thenReturn(Mono.just(List.of(w3, w1)));

        webTestClient.get().uri("/exec/workers/online")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.workers[0]").isEqualTo("w3")
            .jsonPath("$.workers[1]").isEqualTo("w1")
            .jsonPath("$.count").isEqualTo(2);

        verify(selector, never()).onlineWorkers();
    }
}
