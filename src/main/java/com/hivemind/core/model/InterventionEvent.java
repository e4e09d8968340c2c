package com.hivemind.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;

/**
 * Append-only audit record of a recovery monitor intervention.
 *
 * @param attempt retry number this event refers to (1-based); for
 *                {@link InterventionType#MAX_RETRIES_EXCEEDED} the number of retries spent
 * @param backoff delay waited before the retry ({@link Duration#ZERO} for terminal events)
 */
public record InterventionEvent(
    String id,
    @JsonProperty("task_id") String taskId,
    @JsonProperty("swarm_id") String swarmId,
    InterventionType type,
    int attempt,
    Duration backoff,
    String details,
    Instant timestamp
) implements Serializable {}
