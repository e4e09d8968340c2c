package com.hivemind.core.recovery;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hivemind.core.model.TaskStatus;

import java.util.Map;

/**
 * Health statistics of the recovery loop.
 *
 * @param statusCounts       number of tasks per status across all swarms
 * @param recentRetries      RETRY interventions in the last ten minutes
 * @param retrySuccessRate   percentage of retried tasks that are now completed; 100 when none were retried
 * @param cycles             poll cycles run since start
 */
public record RecoveryHealth(
    @JsonProperty("status_counts") Map<TaskStatus, Long> statusCounts,
    @JsonProperty("recent_retries") long recentRetries,
    @JsonProperty("retry_success_rate") double retrySuccessRate,
    long cycles
) {}
