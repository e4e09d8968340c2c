package com.hivemind.core.planner;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hivemind.core.model.AgentRole;
import com.hivemind.core.model.TaskPayload;

import java.util.List;
import java.util.Map;

/**
 * A planner's decomposition of a request: the agents of a swarm and its task graph.
 * Validated by {@link PlanValidator} before it is stored.
 */
public record SwarmPlan(
    String name,
    Map<String, Object> metadata,
    List<PlannedAgent> agents,
    List<PlannedTask> tasks
) {

    public SwarmPlan {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
        agents = agents != null ? List.copyOf(agents) : List.of();
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
    }

    public record PlannedAgent(String id, AgentRole role) {}

    /**
     * @param agentId      agent the task is assigned to
     * @param dependencies ids of tasks that must complete first
     */
    public record PlannedTask(
        String id,
        @JsonProperty("agent_id") String agentId,
        String description,
        int priority,
        List<String> dependencies,
        TaskPayload payload
    ) {
        public PlannedTask {
            dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        }
    }
}
