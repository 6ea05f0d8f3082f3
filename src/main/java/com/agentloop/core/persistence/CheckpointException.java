package com.agentloop.core.persistence;

import com.agentloop.core.error.AgentLoopException;

public class CheckpointException extends AgentLoopException {

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
