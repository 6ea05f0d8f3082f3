package com.agentloop.core.model;

import java.util.List;
import java.util.Map;

/**
 * A single unit of work within a task graph, executed through one capability call.
 *
 * @param id unique identifier within its graph (e.g., "TASK-001")
 * @param description natural-language intent
 * @param capabilityRef name of the capability to invoke
 * @param arguments arguments passed to the capability
 * @param dependencies ids of nodes that must succeed (or be skipped) first, in declaration order
 * @param status current status
 * @param result capability output once succeeded
 * @param error diagnostic once failed, or the reason a node was skipped
 * @param retryCount failed attempts so far
 */
public record TaskNode(
        String id,
        String description,
        String capabilityRef,
        Map<String, String> arguments,
        List<String> dependencies,
        TaskStatus status,
        String result,
        String error,
        int retryCount
) {

    public TaskNode {
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        status = status == null ? TaskStatus.PENDING : status;
    }

    public static TaskNode pending(String id, String description, String capabilityRef,
                                   Map<String, String> arguments, List<String> dependencies) {
        return new TaskNode(id, description, capabilityRef, arguments, dependencies,
                TaskStatus.PENDING, null, null, 0);
    }

    public TaskNode withStatus(TaskStatus newStatus) {
        return new TaskNode(id, description, capabilityRef, arguments, dependencies,
                newStatus, result, error, retryCount);
    }

    public TaskNode succeeded(String output) {
        return new TaskNode(id, description, capabilityRef, arguments, dependencies,
                TaskStatus.SUCCEEDED, output, null, retryCount);
    }

    public TaskNode failed(String diagnostic) {
        return new TaskNode(id, description, capabilityRef, arguments, dependencies,
                TaskStatus.FAILED, null, diagnostic, retryCount + 1);
    }

    public TaskNode skipped(String reason) {
        return new TaskNode(id, description, capabilityRef, arguments, dependencies,
                TaskStatus.SKIPPED, null, reason, retryCount);
    }

    /** Back to pending for another attempt; the last error is kept for the planner and logs. */
    public TaskNode resetForRetry() {
        return new TaskNode(id, description, capabilityRef, arguments, dependencies,
                TaskStatus.PENDING, null, error, retryCount);
    }
}
