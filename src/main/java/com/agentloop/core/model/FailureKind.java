package com.agentloop.core.model;

/**
 * Why a node attempt did not succeed.
 */
public enum FailureKind {
    /** The capability reported an error or threw. */
    CAPABILITY,
    /** The per-node timeout elapsed. Retried like a capability error. */
    TIMEOUT,
    /** The session deadline aborted the call. Never retried. */
    SESSION_TIMEOUT
}
