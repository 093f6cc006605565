package com.whereq.gridx.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

/**
 * Error body returned by every controller
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    String error;
    Object details;

    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, null);
    }
}
