package com.whereq.gridx.controller;

import com.whereq.gridx.model.Worker;
import com.whereq.gridx.support.WebLayerTestConfig;
import com.whereq.gridx.worker.WorkerRegistry;
import com.whereq.gridx.worker.WorkerSelector;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.mockito.Mockito.when;

@WebFluxTest(controllers = HealthController.class)
@Import(WebLayerTestConfig.class)
class HealthControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private WorkerRegistry workerRegistry;

    @MockBean
    private WorkerSelector workerSelector;

    @Test
    void healthCountsOnlineWorkers() {
        when(workerRegistry.snapshot()).thenReturn(List.of(
            Worker.builder().name("w1").ip("10.0.0.1").build(),
            Worker.builder().name("w2").ip("10.0.0.2").build()));
        when(workerSelector.onlineWorkers()).thenReturn(Mono.just(List.of("w1")));

        webTestClient.get().uri("/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("UP")
            .jsonPath("$.service").isEqualTo("whereq-gridx")
            .jsonPath("$.workers.online").isEqualTo(1)
            .jsonPath("$.workers.total").isEqualTo(2)
            .jsonPath("$.workers.status").isEqualTo("CONNECTED");
    }

    @Test
    void allWorkersDownIsUnreachable() {
        when(workerRegistry.snapshot()).thenReturn(List.of(Worker.builder().name("w1").ip("10.0.0.1").build()));
        when(workerSelector.onlineWorkers()).thenReturn(Mono.just(List.of()));

        webTestClient.get().uri("/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.workers.status").isEqualTo("UNREACHABLE");
    }
}
