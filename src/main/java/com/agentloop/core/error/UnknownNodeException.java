package com.agentloop.core.error;

public class UnknownNodeException extends GraphIntegrityException {

    public UnknownNodeException(String nodeId) {
        super("Unknown task node '" + nodeId + "'");
    }

    public UnknownNodeException(String nodeId, String referencedBy) {
        super("Task node '" + referencedBy + "' depends on unknown node '" + nodeId + "'");
    }
}
