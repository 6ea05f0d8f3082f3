package com.agentloop.core.engine;

import com.agentloop.core.model.LoopPhase;
import com.agentloop.core.validation.GateDecision;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.action.NodeAction;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * The compiled LangGraph4j {@link StateGraph} one session runs on.
 * <p>
 * Graph topology:
 * <pre>
 *   START -> enter -> [routeByPhase] -> planning | ... | END   (resumed sessions re-enter mid-loop)
 *   planning    -> [routeByPhase]         -> execution | END
 *   execution   -> [routeByPhase]         -> observation | END
 *   observation -> [routeByPhase]         -> reflection | validation | END
 *   reflection  -> [routeByPhase]         -> validation | END
 *   validation  -> [routeAfterValidation] -> END (DONE, FAIL) | execution (CONTINUE) | replanning (REPLAN)
 *   replanning  -> [routeByPhase]         -> planning | END
 * </pre>
 * With a checkpoint saver the graph checkpoints after every node, keyed by the session id.
 */
final class LoopGraph {

    private static final Logger log = LoggerFactory.getLogger(LoopGraph.class);

    static final String ENTER = "enter";
    static final String PLANNING = nodeName(LoopPhase.PLANNING);
    static final String EXECUTION = nodeName(LoopPhase.EXECUTION);
    static final String OBSERVATION = nodeName(LoopPhase.OBSERVATION);
    static final String REFLECTION = nodeName(LoopPhase.REFLECTION);
    static final String VALIDATION = nodeName(LoopPhase.VALIDATION);
    static final String REPLANNING = nodeName(LoopPhase.REPLANNING);
    static final String FAILED = nodeName(LoopPhase.FAILED);

    /** Runs the work of one phase node and returns the state update. */
    @FunctionalInterface
    interface PhaseStep {
        Map<String, Object> apply(LoopPhase phase, LoopGraphState state) throws Exception;
    }

    private final CompiledGraph<LoopGraphState> compiledGraph;

    LoopGraph(NodeAction<LoopGraphState> enter, PhaseStep step, BaseCheckpointSaver checkpointSaver,
              int recursionLimit) throws Exception {
        var graph = new StateGraph<>(LoopGraphState.SCHEMA, LoopGraphState::new)
                .addNode(ENTER, node_async(enter))
                .addNode(PLANNING, node_async(state -> step.apply(LoopPhase.PLANNING, state)))
                .addNode(EXECUTION, node_async(state -> step.apply(LoopPhase.EXECUTION, state)))
                .addNode(OBSERVATION, node_async(state -> step.apply(LoopPhase.OBSERVATION, state)))
                .addNode(REFLECTION, node_async(state -> step.apply(LoopPhase.REFLECTION, state)))
                .addNode(VALIDATION, node_async(state -> step.apply(LoopPhase.VALIDATION, state)))
                .addNode(REPLANNING, node_async(state -> step.apply(LoopPhase.REPLANNING, state)))
                .addEdge(START, ENTER)
                .addConditionalEdges(ENTER,
                        edge_async(LoopGraph::routeByPhase),
                        entryRoutes())
                .addConditionalEdges(PLANNING,
                        edge_async(LoopGraph::routeByPhase),
                        Map.of(EXECUTION, EXECUTION, FAILED, END))
                .addConditionalEdges(EXECUTION,
                        edge_async(LoopGraph::routeByPhase),
                        Map.of(OBSERVATION, OBSERVATION, FAILED, END))
                .addConditionalEdges(OBSERVATION,
                        edge_async(LoopGraph::routeByPhase),
                        Map.of(REFLECTION, REFLECTION, VALIDATION, VALIDATION, FAILED, END))
                .addConditionalEdges(REFLECTION,
                        edge_async(LoopGraph::routeByPhase),
                        Map.of(VALIDATION, VALIDATION, FAILED, END))
                .addConditionalEdges(VALIDATION,
                        edge_async(LoopGraph::routeAfterValidation),
                        Map.of(GateDecision.Route.DONE.name(), END,
                                GateDecision.Route.CONTINUE.name(), EXECUTION,
                                GateDecision.Route.REPLAN.name(), REPLANNING,
                                GateDecision.Route.FAIL.name(), END))
                .addConditionalEdges(REPLANNING,
                        edge_async(LoopGraph::routeByPhase),
                        Map.of(PLANNING, PLANNING, FAILED, END));

        var configBuilder = CompileConfig.builder()
                .recursionLimit(recursionLimit);
        if (checkpointSaver != null) {
            configBuilder.checkpointSaver(checkpointSaver);
            log.debug("Loop graph compiled with checkpoint saver: {}", checkpointSaver.getClass().getSimpleName());
        } else {
            log.debug("Loop graph compiled without checkpoint saver (state will not be persisted)");
        }
        this.compiledGraph = graph.compile(configBuilder.build());
    }

    Optional<LoopGraphState> invoke(Map<String, Object> inputs, RunnableConfig config) throws Exception {
        return compiledGraph.invoke(inputs, config);
    }

    static String nodeName(LoopPhase phase) {
        return phase.name().toLowerCase(Locale.ROOT);
    }

    /** Follows the phase the last node entered; terminal phases route to their own key. */
    static String routeByPhase(LoopGraphState state) {
        return nodeName(state.phase());
    }

    /**
     * Follows the validation gate's decision. A validation node that failed outright leaves
     * no usable route and ends the graph.
     */
    static String routeAfterValidation(LoopGraphState state) {
        if (state.phase() == LoopPhase.FAILED || state.route().isEmpty()) {
            return GateDecision.Route.FAIL.name();
        }
        return state.route();
    }

    private static Map<String, String> entryRoutes() {
        var routes = new HashMap<String, String>();
        for (LoopPhase phase : LoopPhase.values()) {
            routes.put(nodeName(phase), phase.isTerminal() ? END : nodeName(phase));
        }
        return routes;
    }
}
