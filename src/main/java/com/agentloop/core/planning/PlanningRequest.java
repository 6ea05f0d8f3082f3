package com.agentloop.core.planning;

import com.agentloop.core.capability.CapabilityDescriptor;
import com.agentloop.core.context.EffectiveView;
import com.agentloop.core.graph.TaskGraph;

import java.util.List;

/**
 * Everything a planner may look at.
 *
 * @param goal root goal text
 * @param view current effective view of the session context
 * @param capabilities capabilities that task nodes may reference
 * @param priorGraph graph being replaced, {@code null} on the first pass
 * @param feedback validation feedback that triggered replanning, {@code null} on the first pass
 */
public record PlanningRequest(
        String goal,
        EffectiveView view,
        List<CapabilityDescriptor> capabilities,
        TaskGraph priorGraph,
        String feedback
) {

    public boolean replanning() {
        return priorGraph != null;
    }
}
