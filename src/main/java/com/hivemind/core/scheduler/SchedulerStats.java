package com.hivemind.core.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Scheduler snapshot for dashboards and the CLI.
 *
 * @param cyclePath task ids of a dependency cycle, empty when the graph is acyclic
 */
public record SchedulerStats(
    SwarmProgress progress,
    @JsonProperty("ready_tasks") int readyTasks,
    @JsonProperty("has_cycle") boolean hasCycle,
    @JsonProperty("cycle_path") List<String> cyclePath
) {

    public SchedulerStats {
        cyclePath = cyclePath != null ? List.copyOf(cyclePath) : List.of();
    }
}
