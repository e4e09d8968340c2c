package com.hivemind.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Hivemind-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String SWARM_ID = "swarmId";
    public static final String TASK_ID = "taskId";
    public static final String AGENT_ID = "agentId";

    private MdcContext() {}

    public static void setSwarm(String swarmId) {
        MDC.put(SWARM_ID, swarmId);
    }

    public static void setTask(String swarmId, String taskId, String agentId) {
        MDC.put(SWARM_ID, swarmId);
        MDC.put(TASK_ID, taskId);
        if (agentId != null) {
            MDC.put(AGENT_ID, agentId);
        }
    }

    public static void clear() {
        MDC.remove(SWARM_ID);
        MDC.remove(TASK_ID);
        MDC.remove(AGENT_ID);
    }
}
