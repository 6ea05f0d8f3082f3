package com.agentloop.core.error;

/**
 * Base type for every error raised by the loop core.
 */
public class AgentLoopException extends RuntimeException {

    public AgentLoopException(String message) {
        super(message);
    }

    public AgentLoopException(String message, Throwable cause) {
        super(message, cause);
    }
}
