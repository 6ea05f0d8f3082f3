package com.agentloop.core.execution;

import com.agentloop.core.model.FailureKind;

/**
 * Result of one dispatched node attempt.
 *
 * @param failureKind {@code null} when the attempt succeeded
 */
public record NodeOutcome(
        String nodeId,
        String capabilityRef,
        boolean succeeded,
        String output,
        String error,
        FailureKind failureKind,
        long elapsedMs
) {

    static NodeOutcome success(String nodeId, String capabilityRef, String output, long elapsedMs) {
        return new NodeOutcome(nodeId, capabilityRef, true, output, null, null, elapsedMs);
    }

    static NodeOutcome failure(String nodeId, String capabilityRef, FailureKind kind, String error, long elapsedMs) {
        return new NodeOutcome(nodeId, capabilityRef, false, null, error, kind, elapsedMs);
    }

    /** Whether the failure may be retried; session timeouts never are. */
    public boolean retryable() {
        return !succeeded && failureKind != FailureKind.SESSION_TIMEOUT;
    }
}
