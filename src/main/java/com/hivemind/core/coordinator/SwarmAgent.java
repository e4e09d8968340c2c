package com.hivemind.core.coordinator;

import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskResult;

/**
 * A worker that executes tasks on behalf of one agent id.
 * <p>
 * Implementations may throw; the coordinator turns any exception into a
 * {@code FAILED} {@link TaskResult}.
 */
@FunctionalInterface
public interface SwarmAgent {

    TaskResult execute(Task task) throws Exception;
}
