package com.whereq.gridx.worker;

import com.whereq.gridx.dto.PingSummary;
import com.whereq.gridx.dto.PoolHealth;
import com.whereq.gridx.dto.PoolStatus;
import com.whereq.gridx.dto.WorkerView;
import com.whereq.gridx.model.Worker;
import com.whereq.gridx.model.WorkerHealth;
import com.whereq.gridx.model.WorkerStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read views over the worker pool for the worker endpoints
 */
@Service
@RequiredArgsConstructor
public class WorkerPoolService {

    private final WorkerRegistry registry;
    private final WorkerSelector selector;
    private final WorkerAgentClient agentClient;

    /**
     * Every registered worker with its ping result, registry order
     */
    public Mono<List<WorkerView>> listWorkers() {
        return Flux.fromIterable(registry.snapshot())
            .flatMapSequential(worker -> agentClient.ping(worker).map(online -> WorkerView.of(worker, online)))
            .collectList();
    }

    public Mono<PingSummary> pingAll() {
        return Flux.fromIterable(registry.snapshot())
            .flatMapSequential(worker -> agentClient.ping(worker).map(online -> Map.entry(worker.getName(), online)))
            .collect(LinkedHashMap<String, Boolean>::new, (map, entry) -> map.put(entry.getKey(), entry.getValue()))
            .map(PingSummary::new);
    }

    /**
     * One worker with ping and telemetry. Errors with
     * {@link com.whereq.gridx.exception.WorkerNotFoundException} for an unknown name.
     */
    public Mono<WorkerView> describe(String name) {
        return Mono.fromCallable(() -> registry.get(name))
            .flatMap(worker -> selector.probe(worker, 0))
            .map(health -> WorkerView.of(health).toBuilder().state(null).build());
    }

    public Mono<Boolean> ping(String name) {
        return Mono.fromCallable(() -> registry.get(name)).flatMap(agentClient::ping);
    }

    /**
     * Telemetry of one worker; empty when it is offline or unreachable
     */
    public Mono<WorkerStatus> status(String name) {
        return Mono.fromCallable(() -> registry.get(name))
            .flatMap(worker -> agentClient.status(worker).onErrorResume(e -> Mono.empty()));
    }

    public Mono<PoolStatus> poolStatus() {
        return selector.probeAll().map(all -> {
            Map<String, WorkerView> workers = new LinkedHashMap<>();
            all.forEach(health -> workers.put(health.getName(), WorkerView.of(health)));
            int online = (int) all.stream().filter(WorkerHealth::isOnline).count();
            String recommended = all.stream()
                .filter(WorkerSelector::isEligible)
                .min(WorkerSelector.RANKING)
                .map(WorkerHealth::getName)
                .orElse(null);
            return PoolStatus.builder()
                .totalWorkers(all.size())
                .onlineWorkers(online)
                .offlineWorkers(all.size() - online)
                .workers(workers)
                .recommendedWorker(recommended)
                .build();
        });
    }

    public Mono<PoolHealth> poolHealth() {
        List<Worker> known = registry.snapshot();
        return selector.onlineWorkers().map(online -> PoolHealth.of(online, known.size()));
    }
}
