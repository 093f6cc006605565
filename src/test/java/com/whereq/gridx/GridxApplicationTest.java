package com.whereq.gridx;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.actuate.observability.AutoConfigureObservability;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureObservability
class GridxApplicationTest {

    @Autowired
    private WebTestClient webTestClient;

    @Test
    void healthWithoutWorkers() {
        webTestClient.get().uri("/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("UP")
            .jsonPath("$.workers.total").isEqualTo(0)
            .jsonPath("$.workers.status").isEqualTo("CONNECTED");
    }

    @Test
    void unconditionedLoopIsRejectedBeforeAnyJobExists() {
        webTestClient.post().uri("/exec/safe-execute")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("code", "while True:\n    x = 1\n", "user_id", "carol"))
            .exchange()
            .expectStatus().isEqualTo(422)
            .expectBody()
            .jsonPath("$.decision").isEqualTo("REJECT")
            .jsonPath("$.analysis.should_execute").isEqualTo(false)
            .jsonPath("$.analysis.issues[0].type").isEqualTo("infinite_loop");

        webTestClient.get().uri("/exec/jobs?user_id=carol")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.count").isEqualTo(0);
    }

    @Test
    void autoExecutionWithoutWorkersIsUnavailable() {
        webTestClient.post().uri("/exec/auto?command=hostname")
            .exchange()
            .expectStatus().isEqualTo(503)
            .expectBody()
            .jsonPath("$.outcome").isEqualTo("no_eligible_worker");
    }

    @Test
    void prometheusEndpointIsExposed() {
        webTestClient.get().uri("/actuator/prometheus")
            .exchange()
            .expectStatus().isOk();
    }
}
