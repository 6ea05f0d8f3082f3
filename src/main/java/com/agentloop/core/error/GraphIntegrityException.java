package com.agentloop.core.error;

/**
 * Programming or configuration error in a task graph. Never retried.
 */
public abstract class GraphIntegrityException extends AgentLoopException {

    protected GraphIntegrityException(String message) {
        super(message);
    }
}
