package com.agentloop.core.planning;

import com.agentloop.core.model.TaskPlan;

/**
 * Produces a task decomposition for a goal.
 */
@FunctionalInterface
public interface PlanningPort {

    /**
     * @throws com.agentloop.core.error.PlanningException when no usable plan can be produced
     */
    TaskPlan plan(PlanningRequest request);
}
