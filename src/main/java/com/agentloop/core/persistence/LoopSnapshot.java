package com.agentloop.core.persistence;

import com.agentloop.core.context.ContextSnapshot;
import com.agentloop.core.execution.NodeOutcome;
import com.agentloop.core.model.LoopPhase;
import com.agentloop.core.model.TaskNode;
import com.agentloop.core.model.Termination;
import com.agentloop.core.model.ValidationResult;

import java.time.Instant;
import java.util.List;

/**
 * Everything needed to re-enter a session's state machine, taken at a phase boundary.
 *
 * @param phase phase the session will run next
 * @param graph current task graph, {@code null} before the first planning pass
 * @param stagedGraph graph produced by replanning and not yet installed
 * @param phaseHistory every phase entered so far, in order
 */
public record LoopSnapshot(
        String sessionId,
        String goal,
        LoopPhase phase,
        int iteration,
        int replanCount,
        Termination termination,
        String reason,
        String failureCause,
        boolean timedOut,
        GraphState graph,
        GraphState stagedGraph,
        ContextSnapshot context,
        ValidationResult lastValidation,
        List<NodeOutcome> lastWave,
        List<LoopPhase> phaseHistory,
        Instant savedAt
) {

    public LoopSnapshot {
        lastWave = lastWave == null ? List.of() : List.copyOf(lastWave);
        phaseHistory = phaseHistory == null ? List.of() : List.copyOf(phaseHistory);
    }

    /** Persisted form of a task graph. */
    public record GraphState(String goal, int planVersion, List<TaskNode> nodes) {

        public GraphState {
            nodes = nodes == null ? List.of() : List.copyOf(nodes);
        }
    }
}
