package com.hivemind.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A single unit of work within a swarm, executed by one agent.
 *
 * @param id           unique identifier (e.g., "TASK-001")
 * @param swarmId      owning swarm
 * @param agentId      agent the planner assigned the task to
 * @param description  what this task should accomplish
 * @param status       current execution status
 * @param priority     higher is more urgent
 * @param dependencies IDs of tasks that must complete first, in planner order
 * @param payload      typed work payload; its kind decides routing
 * @param attempts     retries already spent by the recovery monitor
 * @param updatedAt    last status change, stamped by the task store
 * @param version      optimistic-lock version, managed by the task store
 */
public record Task(
    String id,
    @JsonProperty("swarm_id") String swarmId,
    @JsonProperty("agent_id") String agentId,
    String description,
    TaskStatus status,
    int priority,
    List<String> dependencies,
    TaskPayload payload,
    int attempts,
    @JsonProperty("updated_at") Instant updatedAt,
    long version
) implements Serializable {

    public Task {
        Objects.requireNonNull(id, "id must not be null");
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        if (status == null) {
            status = TaskStatus.PENDING;
        }
    }

    /**
     * Creates a fresh, never-stored pending task.
     */
    public static Task pending(String id, String swarmId, String agentId, String description,
                               int priority, List<String> dependencies, TaskPayload payload) {
        return new Task(id, swarmId, agentId, description, TaskStatus.PENDING, priority,
                dependencies, payload, 0, null, 0L);
    }

    /** Kind of work, derived from the payload; tasks without a payload are treated as CODE. */
    @JsonIgnore
    public TaskKind kind() {
        return payload != null ? payload.kind() : TaskKind.CODE;
    }

    public Task withStatus(TaskStatus newStatus) {
        return new Task(id, swarmId, agentId, description, newStatus, priority,
                dependencies, payload, attempts, updatedAt, version);
    }

    public Task withAttempts(int newAttempts) {
        return new Task(id, swarmId, agentId, description, status, priority,
                dependencies, payload, newAttempts, updatedAt, version);
    }

    public Task withDependencies(List<String> newDependencies) {
        return new Task(id, swarmId, agentId, description, status, priority,
                newDependencies, payload, attempts, updatedAt, version);
    }
}
