package com.whereq.gridx.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request for static analysis only
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeRequest {

    @NotNull(message = "Code is required")
    private String code;

    /**
     * Source language, python when omitted
     */
    private String language;
}
