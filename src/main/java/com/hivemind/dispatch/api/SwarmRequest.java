package com.hivemind.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hivemind.core.planner.ProjectScope;
import com.hivemind.core.planner.SwarmPlan;

import java.util.List;
import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/swarms.
 * <p>
 * Either a project scope (planned by the default planner) or a complete {@code plan}
 * built by an external planner. When {@code plan} is present the scope fields are ignored.
 *
 * @param run whether to start the swarm right away; nullable, defaults to true
 */
public record SwarmRequest(
    String project,
    String goal,
    List<String> features,
    @JsonProperty("tech_stack") Map<String, String> techStack,
    List<String> comparables,
    @JsonProperty("stack_confidence") Double stackConfidence,
    @JsonProperty("coverage_target") Double coverageTarget,
    SwarmPlan plan,
    Boolean run
) {

    public ProjectScope toScope() {
        return new ProjectScope(project, goal, features, techStack, comparables, stackConfidence, coverageTarget);
    }

    public boolean shouldRun() {
        return run == null || run;
    }
}
