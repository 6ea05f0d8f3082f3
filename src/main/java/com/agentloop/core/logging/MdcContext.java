package com.agentloop.core.logging;

import org.slf4j.MDC;

/**
 * Manages the loop's MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String SESSION_ID = "sessionId";
    public static final String TASK_ID = "taskId";
    public static final String CAPABILITY = "capability";
    public static final String ITERATION = "iteration";

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put(SESSION_ID, sessionId);
    }

    public static void setTask(String sessionId, String taskId, String capability) {
        MDC.put(SESSION_ID, sessionId);
        MDC.put(TASK_ID, taskId);
        MDC.put(CAPABILITY, capability);
    }

    public static void setIteration(String sessionId, int iteration) {
        MDC.put(SESSION_ID, sessionId);
        MDC.put(ITERATION, String.valueOf(iteration));
    }

    public static void clear() {
        MDC.remove(SESSION_ID);
        MDC.remove(TASK_ID);
        MDC.remove(CAPABILITY);
        MDC.remove(ITERATION);
    }
}
