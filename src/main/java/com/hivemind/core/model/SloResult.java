package com.hivemind.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * Service-level compliance report for one completed swarm run.
 * <p>
 * {@link #compliant} is true only when none of the four dimensions is breached.
 */
public record SloResult(
    @JsonProperty("swarm_id") String swarmId,
    Cost cost,
    Latency latency,
    Coverage coverage,
    Confidence confidence,
    boolean compliant,
    @JsonProperty("evaluated_at") Instant evaluatedAt
) implements Serializable {

    public record Cost(
        long tokens,
        @JsonProperty("estimated_cost") double estimatedCost,
        double threshold,
        boolean breach
    ) implements Serializable {}

    public record Latency(
        @JsonProperty("duration_seconds") double durationSeconds,
        @JsonProperty("threshold_seconds") double thresholdSeconds,
        boolean breach
    ) implements Serializable {}

    public record Coverage(
        double value,
        double threshold,
        boolean breach
    ) implements Serializable {}

    public record Confidence(
        double value,
        double threshold,
        boolean breach
    ) implements Serializable {}
}
