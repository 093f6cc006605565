package com.whereq.gridx.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request to run one command on several workers
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchExecRequest {

    /**
     * Worker names, or ["all"]
     */
    @NotEmpty(message = "No workers specified")
    private List<String> workers;

    @NotBlank(message = "Command is required")
    private String command;

    @Positive(message = "Timeout must be positive")
    private Integer timeout;
}
