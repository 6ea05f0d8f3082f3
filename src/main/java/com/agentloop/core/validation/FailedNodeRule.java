package com.agentloop.core.validation;

import com.agentloop.core.context.EffectiveView;
import com.agentloop.core.model.NodeResult;
import com.agentloop.core.model.Severity;
import com.agentloop.core.model.TaskStatus;
import com.agentloop.core.model.Violation;

import java.util.List;

/**
 * Flags every node that failed beyond its retry budget.
 */
public class FailedNodeRule implements ValidationRule {

    public static final String NAME = "failed-nodes";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Violation> evaluate(EffectiveView view, List<NodeResult> results) {
        return results.stream()
                .filter(r -> r.status() == TaskStatus.FAILED)
                .map(r -> new Violation(NAME, Severity.ERROR,
                        "Node " + r.nodeId() + " [" + r.capabilityRef() + "] failed after "
                                + r.retryCount() + " attempt(s): " + r.error()))
                .toList();
    }
}
