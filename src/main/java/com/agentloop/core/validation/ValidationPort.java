package com.agentloop.core.validation;

import com.agentloop.core.context.EffectiveView;
import com.agentloop.core.model.NodeResult;
import com.agentloop.core.model.ValidationResult;

import java.util.List;

/**
 * Evaluates the loop's current outputs.
 */
@FunctionalInterface
public interface ValidationPort {

    /**
     * @param view          the context as it stands
     * @param latestResults nodes the latest wave touched, plus every node of the current graph
     *                      that failed permanently
     */
    ValidationResult validate(EffectiveView view, List<NodeResult> latestResults);
}
