package com.whereq.gridx.observability;

import com.whereq.gridx.config.GridxProperties;
import com.whereq.gridx.model.Worker;
import com.whereq.gridx.service.JobManager;
import com.whereq.gridx.worker.WorkerRegistry;
import com.whereq.gridx.worker.WorkerSelector;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only aggregation for the admin endpoints
 */
@Service
@RequiredArgsConstructor
public class AdminStatsService {

    private final RequestLog requestLog;
    private final JobManager jobManager;
    private final WorkerRegistry workerRegistry;
    private final WorkerSelector workerSelector;
    private final GridxProperties properties;

    public Mono<AdminStats> stats() {
        return workerSelector.onlineWorkers()
            .map(online -> AdminStats.builder()
                .requests(requestLog.stats())
                .jobs(jobManager.stats())
                .workersOnline(online.size())
                .workersTotal(workerRegistry.snapshot().size())
                .build());
    }

    /**
     * Service settings and the worker list, without anything secret
     */
    public Map<String, Object> config() {
        GridxProperties.JobsConfig jobs = properties.getJobs();
        GridxProperties.DispatchConfig dispatch = properties.getDispatch();

        Map<String, Object> service = new LinkedHashMap<>();
        service.put("pool_size", jobs.getPoolSize());
        service.put("interrupt_on_cancel", jobs.isInterruptOnCancel());
        service.put("retention_max_age_hours", jobs.getRetentionMaxAge().toHours());
        service.put("default_timeout_seconds", dispatch.getDefaultTimeout().toSeconds());
        service.put("max_timeout_seconds", dispatch.getMaxTimeout().toSeconds());
        service.put("agent_port", properties.getWorkers().getAgentPort());
        service.put("max_log_entries", requestLog.getMaxEntries());
        service.put("total_requests", requestLog.stats().getTotal());

        List<Map<String, Object>> peers = workerRegistry.snapshot().stream()
            .map(AdminStatsService::describe)
            .toList();

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("service", service);
        config.put("peers", peers);
        config.put("endpoints", Map.of(
            "exec", "/exec",
            "jobs", "/exec/jobs",
            "workers", "/workers",
            "middleware", "/middleware"));
        return config;
    }

    private static Map<String, Object> describe(Worker worker) {
        Map<String, Object> peer = new LinkedHashMap<>();
        peer.put("name", worker.getName());
        peer.put("ip", worker.getIp());
        peer.put("cpus", worker.getCpus());
        peer.put("memory", worker.getMemory());
        peer.put("gpus", worker.getGpus());
        return peer;
    }
}
