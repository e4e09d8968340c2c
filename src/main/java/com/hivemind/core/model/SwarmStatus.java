package com.hivemind.core.model;

import java.util.Collection;

/**
 * Coarse aggregate status of a swarm, always computed from its tasks.
 */
public enum SwarmStatus {
    IDLE,
    RUNNING,
    PAUSED,
    COMPLETED,
    ERROR;

    /**
     * Derives the swarm status from its tasks.
     *
     * @param tasks      every task of the swarm
     * @param paused     operator pause flag
     * @param maxRetries retry budget; a failed task that spent it is permanent
     */
    public static SwarmStatus aggregate(Collection<Task> tasks, boolean paused, int maxRetries) {
        if (tasks.isEmpty()) {
            return paused ? PAUSED : IDLE;
        }
        boolean allCompleted = tasks.stream().allMatch(t -> t.status() == TaskStatus.COMPLETED);
        if (allCompleted) {
            return COMPLETED;
        }
        boolean exhausted = tasks.stream()
                .anyMatch(t -> t.status() == TaskStatus.FAILED && t.attempts() >= maxRetries);
        if (exhausted) {
            return ERROR;
        }
        if (paused) {
            return PAUSED;
        }
        boolean started = tasks.stream()
                .anyMatch(t -> t.status() != TaskStatus.PENDING || t.attempts() > 0);
        return started ? RUNNING : IDLE;
    }
}
