package com.agentloop.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of an individual node within a task graph.
 */
public enum TaskStatus {
    PENDING,
    READY,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED;

    /**
     * Forward transitions accepted by {@code TaskGraph.mark}. The only way back
     * from {@link #FAILED} is an explicit retry reset.
     */
    public Set<TaskStatus> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(READY, SKIPPED);
            case READY -> EnumSet.of(RUNNING, SKIPPED);
            case RUNNING -> EnumSet.of(SUCCEEDED, FAILED);
            case SUCCEEDED, FAILED, SKIPPED -> EnumSet.noneOf(TaskStatus.class);
        };
    }

    public boolean isFinished() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }

    /** Whether a dependency in this status lets its dependents become ready. */
    public boolean satisfiesDependents() {
        return this == SUCCEEDED || this == SKIPPED;
    }
}
