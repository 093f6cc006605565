package com.whereq.gridx.dto;

import lombok.Value;

@Value
public class CleanupResponse {
    int removed;
    double maxAgeHours;
}
