package com.whereq.gridx.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobControlRequest {

    /**
     * Only "cancel" is supported
     */
    @NotBlank(message = "Action is required")
    private String action;
}
