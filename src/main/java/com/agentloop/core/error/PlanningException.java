package com.agentloop.core.error;

/**
 * Planning could not produce a usable task graph. Fails the session.
 */
public class PlanningException extends AgentLoopException {

    public PlanningException(String message) {
        super(message);
    }

    public PlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
