package com.hivemind.core.planner;

import java.util.List;

/**
 * Thrown when a {@link SwarmPlan} is structurally invalid. Carries every problem found.
 */
public class InvalidPlanException extends RuntimeException {

    private final List<String> problems;

    public InvalidPlanException(List<String> problems) {
        super("Invalid swarm plan: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
