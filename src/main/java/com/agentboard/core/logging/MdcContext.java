package com.agentboard.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing board-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String TASK_ID = "taskId";
    public static final String AGENT = "agent";

    private MdcContext() {}

    public static void setTask(String taskId) {
        MDC.put(TASK_ID, taskId);
    }

    public static void setTask(String taskId, String agent) {
        MDC.put(TASK_ID, taskId);
        if (agent != null) {
            MDC.put(AGENT, agent);
        }
    }

    public static void clear() {
        MDC.remove(TASK_ID);
        MDC.remove(AGENT);
    }
}
