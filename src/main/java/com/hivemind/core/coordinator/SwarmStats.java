package com.hivemind.core.coordinator;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Polling-friendly snapshot of every agent the coordinator knows, in registration order.
 */
public record SwarmStats(
    @JsonProperty("total_agents") int totalAgents,
    Map<String, AgentHealth> agents
) {}
