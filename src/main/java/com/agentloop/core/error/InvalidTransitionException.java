package com.agentloop.core.error;

import com.agentloop.core.model.TaskStatus;

public class InvalidTransitionException extends GraphIntegrityException {

    public InvalidTransitionException(String nodeId, TaskStatus from, TaskStatus to) {
        super("Task node '" + nodeId + "' cannot move from " + from + " to " + to);
    }

    public InvalidTransitionException(String nodeId, String detail) {
        super("Task node '" + nodeId + "': " + detail);
    }
}
