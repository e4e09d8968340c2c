package com.hivemind.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Durable record of an agent in a swarm, owned by the task store.
 *
 * @param avgExecutionMs running average of task execution time in milliseconds
 * @param version        optimistic-lock version, managed by the task store
 */
public record AgentRecord(
    String id,
    @JsonProperty("swarm_id") String swarmId,
    AgentRole role,
    Set<String> capabilities,
    AgentStatus status,
    @JsonProperty("last_heartbeat") Instant lastHeartbeat,
    @JsonProperty("tasks_completed") int tasksCompleted,
    @JsonProperty("tasks_failed") int tasksFailed,
    @JsonProperty("avg_execution_ms") double avgExecutionMs,
    long version
) implements Serializable {

    public AgentRecord {
        Objects.requireNonNull(id, "id must not be null");
        capabilities = capabilities != null ? Set.copyOf(capabilities) : Set.of();
        if (status == null) {
            status = AgentStatus.IDLE;
        }
    }

    public static AgentRecord register(String id, String swarmId, AgentRole role, Instant now) {
        Set<String> capabilities = role != null ? Set.of(role.capabilityTag()) : Set.of();
        return new AgentRecord(id, swarmId, role, capabilities, AgentStatus.IDLE, now, 0, 0, 0.0, 0L);
    }

    public AgentRecord withHealth(AgentStatus newStatus, Instant heartbeat, int completed, int failed, double avgMs) {
        return new AgentRecord(id, swarmId, role, capabilities, newStatus, heartbeat,
                completed, failed, avgMs, version);
    }
}
