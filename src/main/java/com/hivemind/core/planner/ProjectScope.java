package com.hivemind.core.planner;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The request a swarm is planned from.
 *
 * @param project         project name, becomes the swarm name
 * @param goal            one-line description of what should be built
 * @param features        features to implement
 * @param techStack       chosen stack, e.g. {@code {"frontend": "Next.js", "db": "Postgres"}}
 * @param comparables     existing products to research
 * @param stackConfidence confidence (0..1) that the stack was inferred correctly
 * @param coverageTarget  test coverage percentage the test task must reach
 */
public record ProjectScope(
    String project,
    String goal,
    List<String> features,
    @JsonProperty("tech_stack") Map<String, String> techStack,
    List<String> comparables,
    @JsonProperty("stack_confidence") Double stackConfidence,
    @JsonProperty("coverage_target") Double coverageTarget
) {

    public static final double DEFAULT_COVERAGE_TARGET = 95.0;

    public ProjectScope {
        if (project == null || project.isBlank()) {
            throw new IllegalArgumentException("project must not be blank");
        }
        features = features != null ? List.copyOf(features) : List.of();
        techStack = techStack != null ? Map.copyOf(techStack) : Map.of();
        comparables = comparables != null ? List.copyOf(comparables) : List.of();
        if (stackConfidence != null && (stackConfidence < 0 || stackConfidence > 1)) {
            throw new IllegalArgumentException("stack_confidence must be within 0..1, got " + stackConfidence);
        }
        if (coverageTarget == null) {
            coverageTarget = DEFAULT_COVERAGE_TARGET;
        }
    }

    public static ProjectScope of(String project, String goal, List<String> features) {
        return new ProjectScope(project, goal, features, null, null, null, null);
    }

    /** Scope data stored as swarm metadata. */
    public Map<String, Object> toMetadata() {
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("project", project);
        if (goal != null) {
            metadata.put("goal", goal);
        }
        metadata.put("features", features);
        metadata.put("tech_stack", techStack);
        if (stackConfidence != null) {
            metadata.put("stack_confidence", stackConfidence);
        }
        return metadata;
    }
}
