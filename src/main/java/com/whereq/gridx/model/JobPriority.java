package com.whereq.gridx.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Scheduling priority. Waiting jobs with a higher weight start first.
 */
public enum JobPriority {
    LOW(1),
    NORMAL(2),
    HIGH(3),
    CRITICAL(4);

    private final int weight;

    JobPriority(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }

    @JsonCreator
    public static JobPriority fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        try {
            return JobPriority.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown priority: " + value
                + " (expected low, normal, high or critical)");
        }
    }
}
