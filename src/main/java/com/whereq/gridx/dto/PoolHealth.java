package com.whereq.gridx.dto;

import lombok.Value;

import java.util.List;

/**
 * Coarse health grade of the worker pool, derived from the share of
 * workers answering their liveness probe
 */
@Value
public class PoolHealth {
    String healthStatus;
    int healthScore;
    int onlineWorkers;
    int totalWorkers;
    double availabilityPercentage;
    List<String> onlineWorkerNames;

    public static PoolHealth of(List<String> online, int total) {
        int up = online.size();
        String grade;
        int score;
        if (total == 0) {
            grade = "no_workers";
            score = 0;
        } else if (up == 0) {
            grade = "all_offline";
            score = 0;
        } else if (up >= total) {
            grade = "excellent";
            score = 100;
        } else if ((double) up / total >= 0.8) {
            grade = "good";
            score = 80;
        } else if ((double) up / total >= 0.5) {
            grade = "fair";
            score = 60;
        } else {
            grade = "poor";
            score = 40;
        }
        double availability = total > 0 ? Math.round(up * 10_000.0 / total) / 100.0 : 0.0;
        return new PoolHealth(grade, score, up, total, availability, List.copyOf(online));
    }
}
