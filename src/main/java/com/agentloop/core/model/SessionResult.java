package com.agentloop.core.model;

import java.util.List;
import java.util.Map;

/**
 * Final, structured outcome of an agent loop session.
 * <p>
 * {@code succeededResults} always holds the outputs of every node that succeeded,
 * whatever the final phase.
 */
public record SessionResult(
        String sessionId,
        LoopPhase phase,
        Termination termination,
        String reason,
        String failureCause,
        int iterations,
        int replans,
        List<NodeResult> nodes,
        Map<String, String> succeededResults,
        ValidationResult lastValidation,
        String effectiveView,
        List<LoopPhase> phaseHistory
) {

    public boolean completed() {
        return phase == LoopPhase.DONE;
    }
}
