package com.hivemind.core.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Completion progress of a swarm.
 *
 * @param percent completed / total * 100, rounded to one decimal; 0.0 for an empty swarm
 */
public record SwarmProgress(
    double percent,
    int completed,
    @JsonProperty("in_progress") int inProgress,
    int pending,
    int failed,
    int total
) {

    public static SwarmProgress of(int completed, int inProgress, int pending, int failed) {
        int total = completed + inProgress + pending + failed;
        double percent = total == 0 ? 0.0 : Math.round(completed * 1000.0 / total) / 10.0;
        return new SwarmProgress(percent, completed, inProgress, pending, failed, total);
    }
}
