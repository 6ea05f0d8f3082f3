package com.agentloop.core.validation;

import com.agentloop.core.context.EffectiveView;
import com.agentloop.core.model.NodeResult;
import com.agentloop.core.model.Severity;
import com.agentloop.core.model.TaskStatus;
import com.agentloop.core.model.Violation;

import java.util.ArrayList;
import java.util.List;

/**
 * Succeeded nodes must produce output: blank output is an error, very short output a warning.
 */
public class EmptyOutputRule implements ValidationRule {

    public static final String NAME = "empty-output";

    private final int minChars;

    public EmptyOutputRule(int minChars) {
        this.minChars = minChars;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Violation> evaluate(EffectiveView view, List<NodeResult> results) {
        var violations = new ArrayList<Violation>();
        for (NodeResult r : results) {
            if (r.status() != TaskStatus.SUCCEEDED) {
                continue;
            }
            String output = r.output();
            if (output == null || output.isBlank()) {
                violations.add(new Violation(NAME, Severity.ERROR, "Node " + r.nodeId() + " produced no output"));
            } else if (output.strip().length() < minChars) {
                violations.add(new Violation(NAME, Severity.WARNING,
                        "Node " + r.nodeId() + " output is shorter than " + minChars + " characters"));
            }
        }
        return violations;
    }
}
