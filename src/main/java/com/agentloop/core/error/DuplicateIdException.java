package com.agentloop.core.error;

public class DuplicateIdException extends GraphIntegrityException {

    public DuplicateIdException(String nodeId) {
        super("Task node '" + nodeId + "' already exists in the graph");
    }
}
