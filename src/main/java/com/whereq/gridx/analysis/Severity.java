package com.whereq.gridx.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
