package com.hivemind.core.model;

/**
 * Kind of action the recovery monitor took on a failed task.
 */
public enum InterventionType {
    /** Task re-queued from FAILED to PENDING after its backoff elapsed. */
    RETRY,
    /** Retry budget spent; the task stays FAILED permanently. */
    MAX_RETRIES_EXCEEDED
}
