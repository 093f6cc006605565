package com.whereq.gridx.model;

import lombok.Builder;
import lombok.Value;

/**
 * A remote execution target as advertised by the worker directory
 */
@Value
@Builder
public class Worker {
    /**
     * Unique key
     */
    String name;

    String ip;

    /**
     * Advertised capability hints, null when unknown
     */
    Integer cpus;

    String memory;

    int gpus;
}
