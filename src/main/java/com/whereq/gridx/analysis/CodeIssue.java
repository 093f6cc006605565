package com.whereq.gridx.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * One static analysis finding
 */
@Value
@Builder
public class CodeIssue {

    @JsonProperty("type")
    IssueKind kind;

    Severity severity;

    /**
     * 1-based source line, 0 when unknown
     */
    int line;

    String message;

    String suggestion;

    public boolean isHigh() {
        return severity == Severity.HIGH;
    }
}
