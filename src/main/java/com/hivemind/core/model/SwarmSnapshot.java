package com.hivemind.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Point-in-time view of a swarm as returned by the task store.
 */
public record SwarmSnapshot(
    Swarm swarm,
    List<Task> tasks,
    List<AgentRecord> agents
) implements Serializable {

    public SwarmSnapshot {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
        agents = agents != null ? List.copyOf(agents) : List.of();
    }

    public SwarmStatus status(int maxRetries) {
        return SwarmStatus.aggregate(tasks, swarm.paused(), maxRetries);
    }
}
