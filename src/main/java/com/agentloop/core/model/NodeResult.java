package com.agentloop.core.model;

/**
 * Read-only view of a node's outcome, handed to validators and returned to callers.
 */
public record NodeResult(
        String nodeId,
        String capabilityRef,
        TaskStatus status,
        String output,
        String error,
        int retryCount
) {

    public static NodeResult of(TaskNode node) {
        return new NodeResult(node.id(), node.capabilityRef(), node.status(),
                node.result(), node.error(), node.retryCount());
    }
}
