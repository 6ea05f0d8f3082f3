package com.agentloop.core.validation;

import com.agentloop.core.context.EffectiveView;
import com.agentloop.core.model.NodeResult;
import com.agentloop.core.model.Violation;

import java.util.List;

/**
 * One named check run by {@link RuleBasedValidator}.
 */
public interface ValidationRule {

    String name();

    List<Violation> evaluate(EffectiveView view, List<NodeResult> results);
}
