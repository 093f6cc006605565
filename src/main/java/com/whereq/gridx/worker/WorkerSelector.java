package com.whereq.gridx.worker;

import com.whereq.gridx.model.Worker;
import com.whereq.gridx.model.WorkerHealth;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;

/**
 * Picks the least loaded live worker.
 * <p>
 * Every call probes the current registry snapshot again; load changes
 * continuously, so nothing is cached between calls.
 */
@Slf4j
@Service
public class WorkerSelector {

    /**
     * Lower combined cpu+memory load first, then more GPUs, then registry order
     */
    static final Comparator<WorkerHealth> RANKING = Comparator
        .comparingDouble(WorkerHealth::combinedLoad)
        .thenComparing(Comparator.comparingInt((WorkerHealth health) -> health.getWorker().getGpus()).reversed())
        .thenComparingInt(WorkerHealth::getOrder);

    private final WorkerRegistry registry;
    private final WorkerAgentClient agentClient;

    public WorkerSelector(WorkerRegistry registry, WorkerAgentClient agentClient) {
        this.registry = registry;
        this.agentClient = agentClient;
    }

    /**
     * Probe every known worker concurrently; results keep registry order
     */
    public Mono<List<WorkerHealth>> probeAll() {
        List<Worker> workers = registry.snapshot();
        return Flux.range(0, workers.size())
            .flatMap(i -> probe(workers.get(i), i))
            .collectSortedList(Comparator.comparingInt(WorkerHealth::getOrder));
    }

    public Mono<WorkerHealth> probe(Worker worker, int order) {
        return agentClient.ping(worker)
            .flatMap(online -> {
                if (!online) {
                    return Mono.just(new WorkerHealth(worker, order, false, null, "unreachable"));
                }
                return agentClient.status(worker)
                    .map(status -> new WorkerHealth(worker, order, true, status, null))
                    .onErrorResume(e -> Mono.just(new WorkerHealth(worker, order, true, null, e.getMessage())))
                    .defaultIfEmpty(new WorkerHealth(worker, order, true, null, "empty status"));
            });
    }

    /**
     * Live workers with telemetry, best first
     */
    public Mono<List<WorkerHealth>> rankEligible() {
        return probeAll().map(all -> all.stream()
            .filter(WorkerSelector::isEligible)
            .sorted(RANKING)
            .toList());
    }

    /**
     * Best worker, or empty when none is eligible
     */
    public Mono<WorkerHealth> selectBest() {
        return rankEligible().flatMap(ranked -> {
            if (ranked.isEmpty()) {
                log.warn("No eligible worker among {} known", registry.snapshot().size());
                return Mono.empty();
            }
            WorkerHealth best = ranked.get(0);
            log.debug("Selected worker {} (load {})", best.getName(), best.combinedLoad());
            return Mono.just(best);
        });
    }

    /**
     * Names of workers whose liveness probe succeeds, in registry order
     */
    public Mono<List<String>> onlineWorkers() {
        List<Worker> workers = registry.snapshot();
        return Flux.range(0, workers.size())
            .flatMap(i -> agentClient.ping(workers.get(i)).map(online -> online ? i : -1))
            .filter(i -> i >= 0)
            .collectSortedList()
            .map(indexes -> indexes.stream().map(i -> workers.get(i).getName()).toList());
    }

    /**
     * A worker that answers the ping but not the status probe is skipped
     */
    static boolean isEligible(WorkerHealth health) {
        return health.isOnline() && health.getStatus() != null;
    }
}
