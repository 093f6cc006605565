package com.whereq.gridx.worker;

import com.whereq.gridx.exception.WorkerNotFoundException;
import com.whereq.gridx.model.Worker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Current set of known workers.
 * <p>
 * Readers get an immutable snapshot; a refresh replaces the whole snapshot
 * atomically, so selection never sees a half-updated view.
 */
@Slf4j
@Service
public class WorkerRegistry {

    private final WorkerDirectory directory;
    private final AtomicReference<List<Worker>> snapshot = new AtomicReference<>(List.of());

    public WorkerRegistry(WorkerDirectory directory) {
        this.directory = directory;
    }

    @PostConstruct
    public void initialize() {
        refresh();
    }

    @Scheduled(fixedRateString = "${gridx.workers.refresh-interval-ms:30000}",
        initialDelayString = "${gridx.workers.refresh-interval-ms:30000}")
    public void refresh() {
        try {
            List<Worker> workers = List.copyOf(directory.loadWorkers());
            List<Worker> previous = snapshot.getAndSet(workers);
            if (previous.size() != workers.size()) {
                log.info("Worker registry refreshed: {} worker(s)", workers.size());
            } else {
                log.debug("Worker registry refreshed: {} worker(s)", workers.size());
            }
        } catch (Exception e) {
            log.error("Worker registry refresh failed, keeping previous snapshot", e);
        }
    }

    public List<Worker> snapshot() {
        return snapshot.get();
    }

    public Optional<Worker> find(String name) {
        return snapshot.get().stream()
            .filter(worker -> worker.getName().equals(name))
            .findFirst();
    }

    public Worker get(String name) {
        return find(name).orElseThrow(() -> new WorkerNotFoundException(name));
    }
}
