package com.whereq.gridx.observability;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Running request totals since start or the last clear
 */
@Value
@Builder
public class RequestStats {
    long total;
    long success;
    long failed;
    Map<String, Long> byEndpoint;
    Map<String, Long> byWorker;
    Map<String, Long> byMethod;

    /**
     * Percentage, two decimals
     */
    public double getSuccessRate() {
        return Math.round(success * 10000.0 / Math.max(total, 1)) / 100.0;
    }

    public int getActiveWorkers() {
        return byWorker.size();
    }

    /**
     * Most requested endpoints, at most ten
     */
    public List<String> getTopEndpoints() {
        return byEndpoint.entrySet().stream()
            .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
            .limit(10)
            .map(Map.Entry::getKey)
            .toList();
    }
}
