package com.whereq.gridx.dto;

import lombok.Value;

import java.util.Map;

/**
 * Liveness of every registered worker
 */
@Value
public class PingSummary {

    /**
     * Worker name to online flag, registry order
     */
    Map<String, Boolean> workers;

    public long getOnline() {
        return workers.values().stream().filter(Boolean::booleanValue).count();
    }

    public int getTotal() {
        return workers.size();
    }

    public long getOffline() {
        return getTotal() - getOnline();
    }
}
