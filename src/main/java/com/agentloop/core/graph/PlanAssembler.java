package com.agentloop.core.graph;

import com.agentloop.core.error.PlanningException;
import com.agentloop.core.model.TaskNode;
import com.agentloop.core.model.TaskPlan;
import com.agentloop.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts a planner's {@link TaskPlan} into a fresh {@link TaskGraph}.
 * <p>
 * When a prior graph is given, every node that already succeeded there is carried
 * into the new graph first, with its result and without dependencies, so later steps
 * can depend on it without it ever running again. Planned steps that reuse one of
 * those ids are dropped.
 */
public final class PlanAssembler {

    private static final Logger log = LoggerFactory.getLogger(PlanAssembler.class);

    private PlanAssembler() {}

    /**
     * @param goal root goal text
     * @param plan planner output
     * @param prior graph being replaced, or {@code null} for the first planning pass
     * @throws PlanningException if the resulting graph has no nodes or a step has no capability
     * @throws com.agentloop.core.error.GraphIntegrityException on duplicate ids, cycles or unknown dependencies
     */
    public static TaskGraph assemble(String goal, TaskPlan plan, TaskGraph prior) {
        int version = prior == null ? 1 : prior.planVersion() + 1;
        var graph = new TaskGraph(goal, version);

        if (prior != null) {
            for (TaskNode done : prior.nodesWithStatus(TaskStatus.SUCCEEDED)) {
                graph.addNode(new TaskNode(done.id(), done.description(), done.capabilityRef(),
                        done.arguments(), List.of(), TaskStatus.SUCCEEDED, done.result(), null, done.retryCount()));
            }
        }
        int carried = graph.size();

        int sequence = 0;
        for (TaskPlan.PlannedStep step : plan.steps()) {
            if (step.capabilityRef() == null || step.capabilityRef().isBlank()) {
                throw new PlanningException("Planned step '" + step.description() + "' names no capability");
            }
            String id = step.id();
            if (id == null || id.isBlank()) {
                do {
                    id = String.format("TASK-%03d", ++sequence);
                } while (graph.contains(id));
            } else if (graph.contains(id) && graph.get(id).status() == TaskStatus.SUCCEEDED) {
                log.info("Dropping planned step {}: already succeeded in plan v{}", id, version - 1);
                continue;
            }
            graph.addNode(TaskNode.pending(id, step.description(), step.capabilityRef(),
                    cleanArguments(step.arguments()), step.dependencies()));
        }

        if (graph.size() == carried) {
            if (carried == 0) {
                throw new PlanningException("Planner returned an empty plan for goal: " + goal);
            }
            log.info("Plan v{} adds no new steps; {} succeeded nodes carried over", version, carried);
        }
        graph.verifyDependencies();

        log.info("Task graph v{}: {} nodes ({} carried) - {}", version, graph.size(), carried,
                graph.nodes().stream().map(n -> n.id() + "[" + n.capabilityRef() + "](deps:" + n.dependencies() + ")").toList());
        return graph;
    }

    private static Map<String, String> cleanArguments(Map<String, String> arguments) {
        if (arguments == null) {
            return Map.of();
        }
        var cleaned = new HashMap<String, String>();
        arguments.forEach((k, v) -> {
            if (k != null && v != null) {
                cleaned.put(k, v);
            }
        });
        return cleaned;
    }
}
