package com.whereq.gridx.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Telemetry reported by a worker agent's status endpoint.
 * Unknown fields are kept in {@link #getDetails()}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkerStatus {

    @JsonProperty("cpu_count")
    private Integer cpuCount;

    @JsonProperty("cpu_percent")
    private Double cpuPercent;

    @JsonProperty("memory_percent")
    private Double memoryPercent;

    @JsonProperty("memory_total_gb")
    private Double memoryTotalGb;

    @JsonProperty("memory_available_gb")
    private Double memoryAvailableGb;

    private String hostname;

    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();

    @JsonAnySetter
    public void putDetail(String key, Object value) {
        details.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getDetails() {
        return details;
    }

    /**
     * CPU load in percent, 0 when not reported
     */
    public double cpuLoad() {
        return cpuPercent != null ? cpuPercent : 0.0;
    }

    /**
     * Memory load in percent. Derived from total/available when the agent
     * does not report it; 0 when neither is known.
     */
    public double memoryLoad() {
        if (memoryPercent != null) {
            return memoryPercent;
        }
        if (memoryTotalGb != null && memoryAvailableGb != null && memoryTotalGb > 0) {
            return (memoryTotalGb - memoryAvailableGb) / memoryTotalGb * 100.0;
        }
        return 0.0;
    }

    public double combinedLoad() {
        return cpuLoad() + memoryLoad();
    }
}
