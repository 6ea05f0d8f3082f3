package com.agentloop.core.planning;

import com.agentloop.core.context.EffectiveView;
import com.agentloop.core.model.NodeResult;

import java.util.List;
import java.util.Optional;

/**
 * Optional advisory step between observation and validation. Sees progress, never the graph itself.
 */
@FunctionalInterface
public interface ReflectionPort {

    /**
     * @param progress current state of every node in the graph
     * @return an advisory note to append to the context, if any
     */
    Optional<String> reflect(String goal, EffectiveView view, List<NodeResult> progress);
}
