package com.hivemind.core.coordinator;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hivemind.core.model.AgentRole;
import com.hivemind.core.model.AgentStatus;

import java.time.Instant;

/**
 * Coordinator-side health view of one agent.
 *
 * @param swarmId        swarm the agent belongs to; null for agents registered outside a swarm
 * @param avgExecutionMs running average over every task the agent executed
 */
public record AgentHealth(
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("swarm_id") String swarmId,
    AgentRole role,
    AgentStatus status,
    @JsonProperty("last_heartbeat") Instant lastHeartbeat,
    @JsonProperty("tasks_completed") int tasksCompleted,
    @JsonProperty("tasks_failed") int tasksFailed,
    @JsonProperty("avg_execution_ms") double avgExecutionMs
) {

    public static AgentHealth idle(String agentId, String swarmId, AgentRole role, Instant now) {
        return new AgentHealth(agentId, swarmId, role, AgentStatus.IDLE, now, 0, 0, 0.0);
    }

    public AgentHealth withStatus(AgentStatus newStatus) {
        return new AgentHealth(agentId, swarmId, role, newStatus, lastHeartbeat, tasksCompleted, tasksFailed, avgExecutionMs);
    }

    public AgentHealth withHeartbeat(Instant heartbeat) {
        return new AgentHealth(agentId, swarmId, role, status, heartbeat, tasksCompleted, tasksFailed, avgExecutionMs);
    }

    public AgentHealth withOutcome(boolean succeeded, long elapsedMs, Instant now) {
        int executed = tasksCompleted + tasksFailed;
        double avg = (avgExecutionMs * executed + elapsedMs) / (executed + 1);
        return new AgentHealth(agentId, swarmId, role,
                succeeded ? AgentStatus.COMPLETED : AgentStatus.FAILED,
                now,
                succeeded ? tasksCompleted + 1 : tasksCompleted,
                succeeded ? tasksFailed : tasksFailed + 1,
                avg);
    }
}
