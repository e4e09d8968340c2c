package com.hivemind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hivemind.core.model.AgentRecord;
import com.hivemind.core.model.SwarmSnapshot;
import com.hivemind.core.model.Task;
import com.hivemind.core.scheduler.SwarmProgress;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JSON response for swarm endpoints.
 */
public record SwarmResponse(
    @JsonProperty("swarm_id") String swarmId,
    String name,
    String status,
    boolean paused,
    boolean running,
    Map<String, Object> metadata,
    @JsonProperty("created_at") Instant createdAt,
    SwarmProgress progress,
    List<Task> tasks,
    List<AgentRecord> agents
) {

    public static SwarmResponse from(SwarmSnapshot snapshot, int maxRetries, SwarmProgress progress, boolean running) {
        var swarm = snapshot.swarm();
        return new SwarmResponse(swarm.id(), swarm.name(), snapshot.status(maxRetries).name(),
                swarm.paused(), running, swarm.metadata(), swarm.createdAt(), progress,
                snapshot.tasks(), snapshot.agents());
    }

    /**
     * Row in GET /api/v1/swarms.
     */
    public record Summary(
        @JsonProperty("swarm_id") String swarmId,
        String name,
        String status,
        double percent,
        @JsonProperty("created_at") Instant createdAt
    ) {}
}
