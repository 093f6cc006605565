package com.whereq.gridx.observability;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One handled HTTP request
 */
@Value
@Builder
public class RequestLogEntry {
    Instant timestamp;
    String method;
    String endpoint;

    /**
     * Worker the request was routed to, null when none
     */
    String worker;

    long durationMs;
    boolean success;
}
