package com.agentloop.core.llm;

import com.agentloop.core.context.EffectiveView;
import com.agentloop.core.model.NodeResult;
import com.agentloop.core.planning.ReflectionPort;

import java.util.List;
import java.util.Optional;

/**
 * Asks the model for a short advisory note on progress so far.
 */
public class LlmReflector implements ReflectionPort {

    static final String SYSTEM_PROMPT = """
            You review the progress of an agent loop. In at most five sentences, point out
            anything that looks wrong, missing or risky about the results so far, and what
            the next steps should pay attention to. Answer NONE if there is nothing to add.
            """;

    private final LlmService llmService;

    public LlmReflector(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public Optional<String> reflect(String goal, EffectiveView view, List<NodeResult> progress) {
        var sb = new StringBuilder("GOAL:\n").append(goal).append("\n\nPROGRESS:\n");
        for (NodeResult r : progress) {
            sb.append("  - ").append(r.nodeId()).append(" [").append(r.capabilityRef()).append("] ")
                    .append(r.status());
            if (r.error() != null) {
                sb.append(": ").append(r.error());
            }
            sb.append('\n');
        }
        sb.append("\nCONTEXT:\n").append(view.render());
        String note = llmService.textCall(SYSTEM_PROMPT, sb.toString());
        if (note.isBlank() || note.equalsIgnoreCase("NONE")) {
            return Optional.empty();
        }
        return Optional.of(note);
    }
}
