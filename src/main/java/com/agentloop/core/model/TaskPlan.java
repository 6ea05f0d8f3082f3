package com.agentloop.core.model;

import java.util.List;
import java.util.Map;

/**
 * Structured plan returned by a planner. Converted into a task graph by {@code PlanAssembler}.
 *
 * @param rationale short explanation of the decomposition
 * @param steps planned steps in execution-friendly order
 */
public record TaskPlan(String rationale, List<PlannedStep> steps) {

    public TaskPlan {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /**
     * One step as proposed by the planner. {@code id} may be blank, in which case a
     * sequential id is assigned.
     */
    public record PlannedStep(
            String id,
            String description,
            String capabilityRef,
            Map<String, String> arguments,
            List<String> dependencies
    ) {
    }
}
