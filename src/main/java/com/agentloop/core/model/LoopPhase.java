package com.agentloop.core.model;

/**
 * Phases of the agent loop state machine.
 */
public enum LoopPhase {
    PLANNING,
    EXECUTION,
    OBSERVATION,
    REFLECTION,
    VALIDATION,
    REPLANNING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
