package com.whereq.gridx.worker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body returned by the worker agent's exec endpoint
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentExecResponse {

    private String output;

    private String error;

    /**
     * Null when the agent omitted it; treated as a failure
     */
    @JsonProperty("exit_code")
    private Integer exitCode;
}
