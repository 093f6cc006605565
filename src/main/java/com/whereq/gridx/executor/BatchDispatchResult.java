package com.whereq.gridx.executor;

import lombok.Value;

import java.util.Map;

/**
 * Per-worker outcomes of one fan-out, keyed in request order
 */
@Value
public class BatchDispatchResult {

    Map<String, DispatchResult> results;

    public long getSuccessCount() {
        return results.values().stream().filter(DispatchResult::isSuccess).count();
    }

    public int getTotal() {
        return results.size();
    }
}
