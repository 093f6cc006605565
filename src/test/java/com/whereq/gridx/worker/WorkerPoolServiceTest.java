package com.whereq.gridx.worker;

import com.whereq.gridx.dto.PoolHealth;
import com.whereq.gridx.exception.WorkerNotFoundException;
import com.whereq.gridx.model.Worker;
import com.whereq.gridx.model.WorkerHealth;
import com.whereq.gridx.model.WorkerStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkerPoolServiceTest {

    private static final Worker W1 = Worker.builder().name("w1").ip("10.0.0.1").cpus(8).gpus(0).build();
    private static final Worker W2 = Worker.builder().name("w2").ip("10.0.0.2").gpus(1).build();

    @Mock
    private WorkerRegistry registry;

    @Mock
    private WorkerSelector selector;

    @Mock
    private WorkerAgentClient agentClient;

    private WorkerPoolService service;

    @BeforeEach
    void setUp() {
        service = new WorkerPoolService(registry, selector, agentClient);
    }

    @Test
    void pingAllCountsOnlineWorkers() {
        when(registry.snapshot()).thenReturn(List.of(W1, W2));
        when(agentClient.ping(W1)).thenReturn(Mono.just(true));
        when(agentClient.ping(W2)).thenReturn(Mono.just(false));

        StepVerifier.create(service.pingAll())
            .assertNext(summary -> {
                assertThat(summary.getWorkers()).containsExactly(
                    entry("w1", true),
                    entry("w2", false));
                assertThat(summary.getOnline()).isEqualTo(1);
                assertThat(summary.getOffline()).isEqualTo(1);
                assertThat(summary.getTotal()).isEqualTo(2);
            })
            .verifyComplete();
    }

    @Test
    void poolStatusRecommendsTheLeastLoadedWorker() {
        WorkerStatus idle = WorkerStatus.builder().cpuPercent(5.0).memoryPercent(20.0).build();
        WorkerStatus busy = WorkerStatus.builder().cpuPercent(80.0).memoryPercent(70.0).build();
        Worker w3 = Worker.builder().name("w3").ip("10.0.0.3").build();
        when(selector.probeAll()).thenReturn(Mono.just(List.of(
            new WorkerHealth(W1, 0, true, busy, null),
            new WorkerHealth(W2, 1, true, idle, null),
            new WorkerHealth(w3, 2, false, null, "unreachable"))));

        StepVerifier.create(service.poolStatus())
            .assertNext(status -> {
                assertThat(status.getTotalWorkers()).isEqualTo(3);
                assertThat(status.getOnlineWorkers()).isEqualTo(2);
                assertThat(status.getOfflineWorkers()).isEqualTo(1);
                assertThat(status.getRecommendedWorker()).isEqualTo("w2");
                assertThat(status.getWorkers()).containsOnlyKeys("w1", "w2", "w3");
                assertThat(status.getWorkers().get("w3").getState()).isEqualTo("inactive");
                assertThat(status.getWorkers().get("w1").getState()).isEqualTo("active");
            })
            .verifyComplete();
    }

    @Test
    void poolStatusWithoutEligibleWorkerHasNoRecommendation() {
        when(selector.probeAll()).thenReturn(Mono.just(List.of(
            new WorkerHealth(W1, 0, true, null, "empty status"))));

        StepVerifier.create(service.poolStatus())
            .assertNext(status -> assertThat(status.getRecommendedWorker()).isNull())
            .verifyComplete();
    }

    @Test
    void describeUnknownWorkerErrors() {
        when(registry.get("ghost")).thenThrow(new WorkerNotFoundException("ghost"));

        StepVerifier.create(service.describe("ghost"))
            .expectError(WorkerNotFoundException.class)
            .verify();
    }

    @Test
    void statusOfUnreachableWorkerIsEmpty() {
        when(registry.get("w1")).thenReturn(W1);
        when(agentClient.status(W1)).thenReturn(Mono.error(new IllegalStateException("connection refused")));

        StepVerifier.create(service.status("w1")).verifyComplete();
    }

    @Test
    void poolHealthGradesAvailability() {
        when(registry.snapshot()).thenReturn(List.of(W1, W2, Worker.builder().name("w3").ip("10.0.0.3").build()));
        when(selector.onlineWorkers()).thenReturn(Mono.just(List.of("w1", "w3")));

        StepVerifier.create(service.poolHealth())
            .assertNext(health -> {
                assertThat(health.getHealthStatus()).isEqualTo("fair");
                assertThat(health.getHealthScore()).isEqualTo(60);
                assertThat(health.getAvailabilityPercentage()).isEqualTo(66.67);
                assertThat(health.getOnlineWorkerNames()).containsExactly("w1", "w3");
            })
            .verifyComplete();
    }

    @Test
    void healthGrades() {
        assertThat(PoolHealth.of(List.of(), 0).getHealthStatus()).isEqualTo("no_workers");
        assertThat(PoolHealth.of(List.of(), 4).getHealthStatus()).isEqualTo("all_offline");
        assertThat(PoolHealth.of(List.of("a", "b", "c", "d"), 4).getHealthScore()).isEqualTo(100);
        assertThat(PoolHealth.of(List.of("a", "b", "c", "d"), 5).getHealthStatus()).isEqualTo("good");
        assertThat(PoolHealth.of(List.of("a"), 3).getHealthStatus()).isEqualTo("poor");
        assertThat(PoolHealth.of(List.of("a"), 3).getAvailabilityPercentage()).isEqualTo(33.33);
    }
}
