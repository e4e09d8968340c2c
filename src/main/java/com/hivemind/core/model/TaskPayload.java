package com.hivemind.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Typed work payload attached to a {@link Task}. There is one variant per {@link TaskKind};
 * the JSON form carries a {@code kind} discriminator so planners submitting plans over
 * HTTP are validated when the body is bound.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TaskPayload.Research.class, name = "research"),
        @JsonSubTypes.Type(value = TaskPayload.Design.class, name = "design"),
        @JsonSubTypes.Type(value = TaskPayload.Plan.class, name = "plan"),
        @JsonSubTypes.Type(value = TaskPayload.Code.class, name = "code"),
        @JsonSubTypes.Type(value = TaskPayload.Test.class, name = "test"),
        @JsonSubTypes.Type(value = TaskPayload.Review.class, name = "review"),
        @JsonSubTypes.Type(value = TaskPayload.Deploy.class, name = "deploy")
})
public interface TaskPayload extends Serializable {

    @JsonIgnore
    TaskKind kind();

    /** Competitive or prior-art research. */
    record Research(List<String> comparables) implements TaskPayload {
        public Research {
            comparables = comparables != null ? List.copyOf(comparables) : List.of();
        }

        @Override
        public TaskKind kind() { return TaskKind.RESEARCH; }
    }

    /** Wireframes, schema or stack design. */
    record Design(Map<String, String> stack) implements TaskPayload {
        public Design {
            stack = stack != null ? Map.copyOf(stack) : Map.of();
        }

        @Override
        public TaskKind kind() { return TaskKind.DESIGN; }
    }

    /** Further decomposition of a goal into features. */
    record Plan(String goal, List<String> features) implements TaskPayload {
        public Plan {
            features = features != null ? List.copyOf(features) : List.of();
        }

        @Override
        public TaskKind kind() { return TaskKind.PLAN; }
    }

    /**
     * Implementation work.
     *
     * @param targetFiles files the task intends to create or modify
     * @param features    features to implement
     */
    record Code(@JsonProperty("target_files") List<String> targetFiles, List<String> features) implements TaskPayload {
        public Code {
            targetFiles = targetFiles != null ? List.copyOf(targetFiles) : List.of();
            features = features != null ? List.copyOf(features) : List.of();
        }

        @Override
        public TaskKind kind() { return TaskKind.CODE; }
    }

    /** Test execution with the coverage percentage the run must reach. */
    record Test(@JsonProperty("coverage_target") double coverageTarget) implements TaskPayload {
        public Test {
            if (coverageTarget < 0 || coverageTarget > 100) {
                throw new IllegalArgumentException("coverage_target must be within 0..100, got " + coverageTarget);
            }
        }

        @Override
        public TaskKind kind() { return TaskKind.TEST; }
    }

    record Review(@JsonProperty("focus_areas") List<String> focusAreas) implements TaskPayload {
        public Review {
            focusAreas = focusAreas != null ? List.copyOf(focusAreas) : List.of();
        }

        @Override
        public TaskKind kind() { return TaskKind.REVIEW; }
    }

    record Deploy(String target) implements TaskPayload {
        @Override
        public TaskKind kind() { return TaskKind.DEPLOY; }
    }
}
