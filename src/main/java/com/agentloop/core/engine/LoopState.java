package com.agentloop.core.engine;

import com.agentloop.core.context.ContextSettings;
import com.agentloop.core.context.ContextStore;
import com.agentloop.core.context.SummarizationPort;
import com.agentloop.core.execution.NodeOutcome;
import com.agentloop.core.graph.TaskGraph;
import com.agentloop.core.model.LoopPhase;
import com.agentloop.core.model.Termination;
import com.agentloop.core.model.ValidationResult;
import com.agentloop.core.persistence.LoopSnapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The controller's own state, carried as a snapshot by every graph checkpoint. Owned by one controller.
 */
public class LoopState {

    private final String sessionId;
    private final String goal;
    private final ContextStore context;
    private final List<LoopPhase> phaseHistory = new ArrayList<>();
    private LoopPhase phase;
    private int iteration;
    private int replanCount;
    private TaskGraph graph;
    private TaskGraph stagedGraph;
    private ValidationResult lastValidation;
    private List<NodeOutcome> lastWave = List.of();
    private Termination termination = Termination.NONE;
    private String reason;
    private String failureCause;
    private boolean timedOut;

    public LoopState(String sessionId, String goal, ContextStore context) {
        this.sessionId = sessionId;
        this.goal = goal;
        this.context = context;
        enter(LoopPhase.PLANNING);
    }

    /**
     * Rebuilds state from a snapshot. The context store is restored without summarizer calls
     * and in-flight nodes go back to pending.
     */
    public static LoopState fromSnapshot(LoopSnapshot snapshot, ContextSettings contextSettings,
                                         SummarizationPort summarizer) {
        var context = ContextStore.restore(contextSettings, summarizer, snapshot.context());
        var state = new LoopState(snapshot.sessionId(), snapshot.goal(), context, snapshot.phaseHistory());
        state.phase = snapshot.phase();
        state.iteration = snapshot.iteration();
        state.replanCount = snapshot.replanCount();
        state.graph = toGraph(snapshot.graph());
        state.stagedGraph = toGraph(snapshot.stagedGraph());
        state.lastValidation = snapshot.lastValidation();
        state.lastWave = snapshot.lastWave();
        state.termination = snapshot.termination();
        state.reason = snapshot.reason();
        state.failureCause = snapshot.failureCause();
        state.timedOut = snapshot.timedOut();
        return state;
    }

    private LoopState(String sessionId, String goal, ContextStore context, List<LoopPhase> history) {
        this.sessionId = sessionId;
        this.goal = goal;
        this.context = context;
        this.phaseHistory.addAll(history);
    }

    public LoopSnapshot toSnapshot() {
        return new LoopSnapshot(sessionId, goal, phase, iteration, replanCount, termination, reason,
                failureCause, timedOut, toGraphState(graph), toGraphState(stagedGraph), context.snapshot(),
                lastValidation, lastWave, phaseHistory, Instant.now());
    }

    private static TaskGraph toGraph(LoopSnapshot.GraphState state) {
        return state == null ? null : TaskGraph.restore(state.goal(), state.planVersion(), state.nodes());
    }

    private static LoopSnapshot.GraphState toGraphState(TaskGraph graph) {
        return graph == null ? null : new LoopSnapshot.GraphState(graph.goal(), graph.planVersion(), graph.nodes());
    }

    void enter(LoopPhase next) {
        this.phase = next;
        phaseHistory.add(next);
    }

    int nextIteration() {
        return ++iteration;
    }

    int nextReplan() {
        return ++replanCount;
    }

    void installGraph(TaskGraph graph) {
        this.graph = graph;
        this.stagedGraph = null;
    }

    void stage(TaskGraph graph) {
        this.stagedGraph = graph;
    }

    void setLastValidation(ValidationResult lastValidation) {
        this.lastValidation = lastValidation;
    }

    void setLastWave(List<NodeOutcome> lastWave) {
        this.lastWave = List.copyOf(lastWave);
    }

    void markTimedOut() {
        this.timedOut = true;
    }

    void terminate(Termination termination, String reason, Throwable cause) {
        this.termination = termination;
        this.reason = reason;
        this.failureCause = cause == null ? null : cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    public String sessionId() {
        return sessionId;
    }

    public String goal() {
        return goal;
    }

    public ContextStore context() {
        return context;
    }

    public LoopPhase phase() {
        return phase;
    }

    public int iteration() {
        return iteration;
    }

    public int replanCount() {
        return replanCount;
    }

    public TaskGraph graph() {
        return graph;
    }

    public TaskGraph stagedGraph() {
        return stagedGraph;
    }

    public ValidationResult lastValidation() {
        return lastValidation;
    }

    public List<NodeOutcome> lastWave() {
        return lastWave;
    }

    public Termination termination() {
        return termination;
    }

    public String reason() {
        return reason;
    }

    public String failureCause() {
        return failureCause;
    }

    public boolean timedOut() {
        return timedOut;
    }

    public List<LoopPhase> phaseHistory() {
        return List.copyOf(phaseHistory);
    }
}
