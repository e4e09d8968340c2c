package com.hivemind.core.scheduler;

/**
 * Schedulability of a pending task with respect to its dependencies.
 */
public enum Readiness {
    /** Every dependency is completed. */
    READY,
    /** At least one dependency has not finished yet; none has failed. */
    WAITING,
    /** At least one dependency failed; the task cannot run until it is retried to completion. */
    BLOCKED
}
