package com.whereq.gridx.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Manually recorded request log entry
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LogEntryRequest {

    @NotBlank(message = "Endpoint is required")
    private String endpoint;

    private String method = "GET";

    private String worker;

    @PositiveOrZero
    private long durationMs;

    private boolean success = true;
}
