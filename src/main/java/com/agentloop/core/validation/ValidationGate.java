package com.agentloop.core.validation;

import com.agentloop.core.model.Severity;
import com.agentloop.core.model.Termination;
import com.agentloop.core.model.ValidationResult;

import java.util.stream.Collectors;

/**
 * Routing rules applied after every validation pass.
 * <ul>
 *   <li>passed, graph terminal, no failed node: done; the reason names any node skipped
 *       after the session deadline</li>
 *   <li>session timed out: failed</li>
 *   <li>passed, graph not terminal: next wave, unless the iteration cap is reached</li>
 *   <li>otherwise: replan when enabled and both caps allow it, else failed</li>
 * </ul>
 */
public final class ValidationGate {

    private ValidationGate() {}

    /**
     * @param result        latest validation result
     * @param graphTerminal whether every node has finished
     * @param graphFailures whether any node failed permanently
     * @param skippedNodes  nodes that finished as skipped without running
     * @param iteration     waves executed so far
     * @param replans       replanning passes so far
     * @param timedOut      whether the session deadline has passed
     */
    public static GateDecision decide(ValidationResult result, boolean graphTerminal, boolean graphFailures,
                                      int skippedNodes, int iteration, int replans, boolean timedOut,
                                      int maxIterations, int maxReplans, boolean enableReplanning) {
        if (result.passed() && graphTerminal && !graphFailures) {
            if (skippedNodes == 0) {
                return GateDecision.done("All nodes finished and validation passed");
            }
            return GateDecision.done(skippedNodes + " node(s) skipped"
                    + (timedOut ? " after session timeout" : "") + ", the rest finished and validation passed");
        }
        if (timedOut) {
            return GateDecision.fail(Termination.FAILED, "session timeout");
        }
        boolean capReached = iteration >= maxIterations;
        if (result.passed() && !graphTerminal) {
            return capReached
                    ? GateDecision.fail(Termination.MAX_ITERATIONS_EXCEEDED,
                            "Iteration cap " + maxIterations + " reached with work remaining")
                    : GateDecision.proceed("Graph has remaining work");
        }

        String why = describe(result, graphFailures);
        if (enableReplanning && !capReached && replans < maxReplans) {
            return GateDecision.replan(why);
        }
        if (capReached) {
            return GateDecision.fail(Termination.MAX_ITERATIONS_EXCEEDED,
                    "Iteration cap " + maxIterations + " reached: " + why);
        }
        if (!enableReplanning) {
            return GateDecision.fail(Termination.FAILED, "Replanning disabled: " + why);
        }
        return GateDecision.fail(Termination.FAILED, "Replanning cap " + maxReplans + " reached: " + why);
    }

    private static String describe(ValidationResult result, boolean graphFailures) {
        String errors = result.violations().stream()
                .filter(v -> v.severity() == Severity.ERROR)
                .map(v -> v.ruleName() + ": " + v.message())
                .collect(Collectors.joining("; "));
        if (!errors.isEmpty()) {
            return errors;
        }
        return graphFailures ? "graph finished with failed nodes" : "validation failed";
    }
}
