package com.whereq.gridx.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to run a shell command on one worker
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExecRequest {

    /**
     * Target worker; auto-selected when omitted
     */
    private String worker;

    @NotBlank(message = "Command is required")
    private String command;

    /**
     * Seconds, 30 when omitted
     */
    @Positive(message = "Timeout must be positive")
    private Integer timeout;
}
