package com.hivemind.core.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hivemind.core.model.SloResult;
import com.hivemind.core.model.SwarmStatus;
import com.hivemind.core.scheduler.SwarmProgress;

import java.util.List;

/**
 * Outcome of one {@link SwarmEngine#run} call.
 *
 * @param slo       the SLO report; null when the run was refused because of a dependency cycle
 * @param cyclePath the offending cycle when the run was refused, otherwise empty
 * @param timedOut  true when the run was abandoned after the configured timeout
 */
public record SwarmRunResult(
    @JsonProperty("swarm_id") String swarmId,
    SwarmStatus status,
    SwarmProgress progress,
    SloResult slo,
    @JsonProperty("cycle_path") List<String> cyclePath,
    @JsonProperty("timed_out") boolean timedOut
) {

    public SwarmRunResult {
        cyclePath = cyclePath != null ? List.copyOf(cyclePath) : List.of();
    }
}
