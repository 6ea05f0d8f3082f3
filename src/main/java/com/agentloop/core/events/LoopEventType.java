package com.agentloop.core.events;

/**
 * Everything a session reports while it runs. Task events always name the node concerned.
 */
public enum LoopEventType {
    SESSION_STARTED("session.started", false),
    PHASE_ENTERED("phase.entered", false),
    TASK_DISPATCHED("task.dispatched", true),
    TASK_SUCCEEDED("task.succeeded", true),
    TASK_RETRYING("task.retrying", true),
    TASK_FAILED("task.failed", true),
    TASK_SKIPPED("task.skipped", true),
    CONTEXT_COMPRESSED("context.compressed", false),
    SESSION_COMPLETED("session.completed", false);

    private final String key;
    private final boolean taskScoped;

    LoopEventType(String key, boolean taskScoped) {
        this.key = key;
        this.taskScoped = taskScoped;
    }

    /** Dotted name used in logs and by external listeners. */
    public String key() {
        return key;
    }

    public boolean taskScoped() {
        return taskScoped;
    }
}
