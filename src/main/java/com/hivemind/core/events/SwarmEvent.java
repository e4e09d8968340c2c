package com.hivemind.core.events;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a swarm runs.
 *
 * @param eventType event type (e.g. "swarm.created", "task.retried", "slo.evaluated")
 * @param swarmId   the swarm this event belongs to
 * @param taskId    the task this event relates to (nullable for swarm-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record SwarmEvent(
    @JsonProperty("event_type") String eventType,
    @JsonProperty("swarm_id") String swarmId,
    @JsonProperty("task_id") String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String SWARM_CREATED = "swarm.created";
    public static final String SWARM_COMPLETED = "swarm.completed";
    public static final String SWARM_CYCLE_DETECTED = "swarm.cycle_detected";
    public static final String TASK_STARTED = "task.started";
    public static final String TASK_COMPLETED = "task.completed";
    public static final String TASK_FAILED = "task.failed";
    public static final String TASK_RETRIED = "task.retried";
    public static final String TASK_RETRIES_EXHAUSTED = "task.retries_exhausted";
    public static final String SLO_EVALUATED = "slo.evaluated";

    public SwarmEvent {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static SwarmEvent of(String eventType, String swarmId, String taskId, Map<String, Object> payload) {
        return of(eventType, swarmId, taskId, payload, Instant.now());
    }

    public static SwarmEvent of(String eventType, String swarmId, String taskId, Map<String, Object> payload,
                                Instant timestamp) {
        return new SwarmEvent(eventType, swarmId, taskId, payload, timestamp);
    }
}
