package com.hivemind.core.store;

/**
 * Thrown when a swarm id is not known to the task store.
 */
public class SwarmNotFoundException extends RuntimeException {

    private final String swarmId;

    public SwarmNotFoundException(String swarmId) {
        super("Swarm not found: " + swarmId);
        this.swarmId = swarmId;
    }

    public String getSwarmId() {
        return swarmId;
    }
}
