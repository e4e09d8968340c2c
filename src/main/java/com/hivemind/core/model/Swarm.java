package com.hivemind.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A bounded unit of work: a set of agents and a dependency graph of tasks.
 * <p>
 * The overall {@link SwarmStatus} is not stored here; it is derived from task
 * states by {@link SwarmSnapshot#status(int)}.
 *
 * @param metadata free-form scope data (project, goal, features, stack confidence)
 * @param paused   set by operators to stop dispatch without touching task states
 */
public record Swarm(
    String id,
    String name,
    Map<String, Object> metadata,
    @JsonProperty("created_at") Instant createdAt,
    boolean paused
) implements Serializable {

    /** Metadata key holding the planner's stack/plan inference confidence (0..1). */
    public static final String CONFIDENCE_KEY = "stack_confidence";

    public Swarm {
        metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Map.of();
    }

    @JsonIgnore
    public double inferenceConfidence() {
        Object value = metadata.get(CONFIDENCE_KEY);
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException e) {
                return 0.0;
            }
        }
        return 0.0;
    }

    public Swarm withPaused(boolean newPaused) {
        return new Swarm(id, name, metadata, createdAt, newPaused);
    }
}
