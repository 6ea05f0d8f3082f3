package com.agentloop.core.llm;

import com.agentloop.core.capability.CapabilityDescriptor;
import com.agentloop.core.error.PlanningException;
import com.agentloop.core.graph.TaskGraph;
import com.agentloop.core.model.TaskNode;
import com.agentloop.core.model.TaskPlan;
import com.agentloop.core.model.TaskStatus;
import com.agentloop.core.planning.PlanningPort;
import com.agentloop.core.planning.PlanningRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks the model for a {@link TaskPlan} given the goal, the registered capabilities and
 * the session's effective view. When replanning, the prior graph's progress and the
 * validation feedback are included.
 */
public class LlmPlanner implements PlanningPort {

    private static final Logger log = LoggerFactory.getLogger(LlmPlanner.class);

    static final String SYSTEM_PROMPT = """
            You are the planner of an agent loop. Decompose the goal into a small set of
            concrete steps, each executed by exactly one of the listed capabilities.

            RULES:
            1. Use only capability names from the AVAILABLE CAPABILITIES list, spelled exactly.
            2. Give every step a short unique id such as "TASK-001".
            3. List in "dependencies" the ids of steps whose output a step needs. Steps with
               no dependency between them may run in parallel. Never create cycles.
            4. Put the inputs a capability needs into "arguments" as string key/value pairs.
            5. Keep the plan minimal: prefer fewer, well-scoped steps.
            6. When replanning, steps marked DONE have already succeeded and must not be
               repeated. You may depend on their ids. Address the feedback directly.

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;

    public LlmPlanner(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public TaskPlan plan(PlanningRequest request) {
        String userPrompt = buildUserPrompt(request);
        TaskPlan plan;
        try {
            plan = llmService.structuredCall(SYSTEM_PROMPT, userPrompt, TaskPlan.class);
        } catch (LlmEmptyResponseException | LlmParseException e) {
            throw new PlanningException("Model did not produce a usable plan: " + e.getMessage(), e);
        }
        if (plan == null || plan.steps().isEmpty()) {
            throw new PlanningException("Model returned a plan with no steps");
        }
        log.info("{} produced {} step(s): {}", request.replanning() ? "Replan" : "Plan",
                plan.steps().size(), plan.rationale());
        return plan;
    }

    String buildUserPrompt(PlanningRequest request) {
        var sb = new StringBuilder();
        sb.append("GOAL:\n").append(request.goal()).append("\n\n");

        sb.append("AVAILABLE CAPABILITIES:\n");
        if (request.capabilities().isEmpty()) {
            sb.append("  (none registered)\n");
        }
        for (CapabilityDescriptor c : request.capabilities()) {
            sb.append("  - ").append(c.name()).append(" [").append(c.kind()).append("]: ")
                    .append(c.description()).append('\n');
        }

        if (request.view() != null && !request.view().isEmpty()) {
            sb.append("\nSESSION CONTEXT:\n").append(request.view().render()).append('\n');
        }

        TaskGraph prior = request.priorGraph();
        if (prior != null) {
            sb.append("\nPREVIOUS PLAN (v").append(prior.planVersion()).append("):\n");
            for (TaskNode node : prior.nodes()) {
                sb.append("  - ").append(node.id()).append(" [").append(node.capabilityRef()).append("] ")
                        .append(node.description()).append(": ")
                        .append(node.status() == TaskStatus.SUCCEEDED ? "DONE" : node.status().name());
                if (node.error() != null) {
                    sb.append(" (").append(node.error()).append(')');
                }
                sb.append('\n');
            }
        }
        if (request.feedback() != null && !request.feedback().isBlank()) {
            sb.append('\n').append(request.feedback()).append('\n');
        }
        return sb.toString();
    }
}
