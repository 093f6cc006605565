package com.whereq.gridx.observability;

import com.whereq.gridx.config.GridxProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded log of recent requests with running totals.
 * All access is serialized on this object.
 */
@Slf4j
@Component
public class RequestLog {

    private final int maxEntries;
    private final Deque<RequestLogEntry> entries = new ArrayDeque<>();

    private long total;
    private long success;
    private long failed;
    private final Map<String, Long> byEndpoint = new LinkedHashMap<>();
    private final Map<String, Long> byWorker = new LinkedHashMap<>();
    private final Map<String, Long> byMethod = new LinkedHashMap<>();

    public RequestLog(GridxProperties properties) {
        this.maxEntries = Math.max(1, properties.getRequestLog().getMaxEntries());
    }

    public synchronized void record(RequestLogEntry entry) {
        entries.addLast(entry);
        while (entries.size() > maxEntries) {
            entries.removeFirst();
        }
        total++;
        if (entry.isSuccess()) {
            success++;
        } else {
            failed++;
        }
        byEndpoint.merge(entry.getEndpoint() != null ? entry.getEndpoint() : "unknown", 1L, Long::sum);
        if (entry.getWorker() != null) {
            byWorker.merge(entry.getWorker(), 1L, Long::sum);
        }
        byMethod.merge(entry.getMethod(), 1L, Long::sum);
    }

    /**
     * Most recent entries, oldest first
     */
    public synchronized List<RequestLogEntry> recent(int limit) {
        List<RequestLogEntry> all = new ArrayList<>(entries);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return List.copyOf(all.subList(from, all.size()));
    }

    public synchronized RequestStats stats() {
        return RequestStats.builder()
            .total(total)
            .success(success)
            .failed(failed)
            .byEndpoint(new LinkedHashMap<>(byEndpoint))
            .byWorker(new LinkedHashMap<>(byWorker))
            .byMethod(new LinkedHashMap<>(byMethod))
            .build();
    }

    public synchronized void clear() {
        entries.clear();
        total = 0;
        success = 0;
        failed = 0;
        byEndpoint.clear();
        byWorker.clear();
        byMethod.clear();
        log.info("Request log cleared");
    }

    public int getMaxEntries() {
        return maxEntries;
    }
}
