package com.hivemind.core.coordinator;

import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskPayload;
import com.hivemind.core.model.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stand-in agent that completes every task without doing any work. Used for agents
 * that have no real implementation registered, so a plan can be exercised end to end.
 * Test tasks report their coverage target as the achieved coverage.
 */
public class DryRunAgent implements SwarmAgent {

    private static final Logger log = LoggerFactory.getLogger(DryRunAgent.class);

    private final String agentId;

    public DryRunAgent(String agentId) {
        this.agentId = agentId;
    }

    @Override
    public TaskResult execute(Task task) {
        log.info("Dry run of {} task {}: {}", task.kind(), task.id(), task.description());
        Double coverage = task.payload() instanceof TaskPayload.Test test ? test.coverageTarget() : null;
        return TaskResult.completed(task.id(), agentId,
                "dry run: " + task.description(), 0L, coverage);
    }
}
