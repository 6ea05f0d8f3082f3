package com.agentloop.core.context;

import com.agentloop.core.model.Round;

import java.util.List;
import java.util.Map;

/**
 * Persistable state of a context store. Restoring it never calls the summarizer.
 */
public record ContextSnapshot(List<Round> rounds, Map<Integer, String> archive, int nextIndex) {

    public ContextSnapshot {
        rounds = rounds == null ? List.of() : List.copyOf(rounds);
        archive = archive == null ? Map.of() : Map.copyOf(archive);
    }

    public static ContextSnapshot empty() {
        return new ContextSnapshot(List.of(), Map.of(), 0);
    }
}
