package com.hivemind.core.model;

/**
 * Health status of an agent as tracked by the coordinator.
 * <p>
 * {@code COMPLETED} and {@code FAILED} describe the outcome of the agent's last task
 * until the engine has stored it; the agent then returns to {@code IDLE}. Only
 * {@code IDLE} agents are picked when a task is rerouted.
 */
public enum AgentStatus {
    IDLE,
    WORKING,
    COMPLETED,
    FAILED,
    WAITING
}
