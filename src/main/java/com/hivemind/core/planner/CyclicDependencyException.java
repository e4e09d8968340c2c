package com.hivemind.core.planner;

import java.util.List;

/**
 * Thrown when the task dependencies of a plan or swarm form a cycle.
 */
public class CyclicDependencyException extends InvalidPlanException {

    private final List<String> cycle;

    public CyclicDependencyException(List<String> cycle) {
        super(List.of("Dependency cycle: " + String.join(" -> ", cycle) + " -> " + cycle.get(0)));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
