package com.hivemind.core.model;

/**
 * Status of an individual task within a swarm.
 */
public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
