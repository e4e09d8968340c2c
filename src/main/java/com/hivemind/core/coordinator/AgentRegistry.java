package com.hivemind.core.coordinator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps agent ids to the {@link SwarmAgent} implementations that execute their tasks.
 */
@Component
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final ConcurrentHashMap<String, SwarmAgent> agents = new ConcurrentHashMap<>();

    public void register(String agentId, SwarmAgent agent) {
        agents.put(agentId, agent);
        log.debug("Registered {} for agent {}", agent.getClass().getSimpleName(), agentId);
    }

    /** Registers {@code agent} only if no implementation is bound to {@code agentId} yet. */
    public boolean registerIfAbsent(String agentId, SwarmAgent agent) {
        return agents.putIfAbsent(agentId, agent) == null;
    }

    public Optional<SwarmAgent> find(String agentId) {
        return agentId == null ? Optional.empty() : Optional.ofNullable(agents.get(agentId));
    }

    public boolean contains(String agentId) {
        return agents.containsKey(agentId);
    }

    public void unregister(String agentId) {
        agents.remove(agentId);
    }

    public Set<String> agentIds() {
        return Set.copyOf(agents.keySet());
    }
}
