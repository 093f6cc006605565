package com.whereq.gridx.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Category of a static analysis finding
 */
public enum IssueKind {
    SYNTAX_ERROR,
    INFINITE_LOOP,
    RESOURCE_HEAVY,
    WARNING;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
