package com.hivemind.core.planner;

/**
 * Decomposes a project scope into a {@link SwarmPlan}.
 */
public interface SwarmPlanner {

    SwarmPlan plan(ProjectScope scope);
}
