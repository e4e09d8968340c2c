package com.hivemind.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Outcome of one agent execution of a task.
 *
 * @param output     agent output (nullable)
 * @param error      failure message (null on success)
 * @param tokensUsed LLM tokens the agent consumed, feeds the cost SLO
 * @param coverage   test coverage percentage reported by the agent (nullable)
 * @param elapsedMs  execution time in milliseconds
 */
public record TaskResult(
    @JsonProperty("task_id") String taskId,
    @JsonProperty("agent_id") String agentId,
    TaskStatus status,
    String output,
    String error,
    @JsonProperty("tokens_used") long tokensUsed,
    Double coverage,
    @JsonProperty("elapsed_ms") long elapsedMs
) implements Serializable {

    public static TaskResult completed(String taskId, String agentId, String output, long tokensUsed, Double coverage) {
        return new TaskResult(taskId, agentId, TaskStatus.COMPLETED, output, null, tokensUsed, coverage, 0L);
    }

    public static TaskResult failed(String taskId, String agentId, String error) {
        return new TaskResult(taskId, agentId, TaskStatus.FAILED, null, error, 0L, null, 0L);
    }

    public boolean succeeded() {
        return status == TaskStatus.COMPLETED;
    }

    public TaskResult withAgent(String newAgentId, long newElapsedMs) {
        return new TaskResult(taskId, newAgentId, status, output, error, tokensUsed, coverage, newElapsedMs);
    }
}
