package com.agentloop.core.model;

/**
 * How a session ended. {@link #NONE} while it is still running.
 */
public enum Termination {
    NONE,
    COMPLETED,
    FAILED,
    MAX_ITERATIONS_EXCEEDED
}
