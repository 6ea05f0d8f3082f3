package com.agentloop.core.engine;

import com.agentloop.core.context.ContextStore;
import com.agentloop.core.error.BudgetExceededException;
import com.agentloop.core.error.GraphIntegrityException;
import com.agentloop.core.error.PlanningException;
import com.agentloop.core.events.LoopEvent;
import com.agentloop.core.events.LoopEventType;
import com.agentloop.core.execution.NodeOutcome;
import com.agentloop.core.execution.WaveExecutor;
import com.agentloop.core.execution.WaveReport;
import com.agentloop.core.graph.PlanAssembler;
import com.agentloop.core.graph.TaskGraph;
import com.agentloop.core.logging.MdcContext;
import com.agentloop.core.model.FailureKind;
import com.agentloop.core.model.LoopPhase;
import com.agentloop.core.model.NodeResult;
import com.agentloop.core.model.Round;
import com.agentloop.core.model.SessionResult;
import com.agentloop.core.model.Severity;
import com.agentloop.core.model.TaskNode;
import com.agentloop.core.model.TaskPlan;
import com.agentloop.core.model.TaskStatus;
import com.agentloop.core.model.Termination;
import com.agentloop.core.model.ValidationResult;
import com.agentloop.core.persistence.LoopCheckpoints;
import com.agentloop.core.persistence.LoopSnapshot;
import com.agentloop.core.planning.PlanningRequest;
import com.agentloop.core.validation.GateDecision;
import com.agentloop.core.validation.ValidationGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Drives one session through planning, execution, observation, optional reflection,
 * validation and optional replanning until it reaches {@link LoopPhase#DONE} or
 * {@link LoopPhase#FAILED}.
 * <p>
 * Each phase is a node of a {@link LoopGraph}; the graph runs on the calling thread and only
 * capability calls within a wave run concurrently. Each execution wave counts as one
 * iteration. Every node hands the graph a full snapshot of the loop state, which the
 * session's checkpoint saver, when there is one, persists after the node. {@link #run()} never
 * throws: every error ends the session in {@code FAILED} with a reason, and succeeded node
 * outputs are always returned.
 */
public class AgentLoopController {

    private static final Logger log = LoggerFactory.getLogger(AgentLoopController.class);

    private final SessionContext session;
    private final LoopSettings settings;
    private final LoopState state;
    private long deadlineNanos;
    private WaveExecutor waves;
    private GateDecision.Route lastRoute;

    public AgentLoopController(SessionContext session, String goal) {
        this(session, new LoopState(session.sessionId(), goal,
                new ContextStore(session.contextSettings(), session.summarizer())));
    }

    private AgentLoopController(SessionContext session, LoopState state) {
        this.session = session;
        this.settings = session.settings();
        this.state = state;
        state.context().setCompressionListener(this::onLevelChanged);
    }

    /**
     * Re-enters the state machine from a snapshot. The session deadline restarts from the
     * moment {@link #run()} is called.
     */
    public static AgentLoopController resume(SessionContext session, LoopSnapshot snapshot) {
        if (!session.sessionId().equals(snapshot.sessionId())) {
            throw new IllegalArgumentException("Snapshot belongs to session " + snapshot.sessionId()
                    + ", not " + session.sessionId());
        }
        var state = LoopState.fromSnapshot(snapshot, session.contextSettings(), session.summarizer());
        log.info("Resuming session {} at {} (iteration {}, replans {})",
                snapshot.sessionId(), snapshot.phase(), snapshot.iteration(), snapshot.replanCount());
        return new AgentLoopController(session, state);
    }

    public LoopState state() {
        return state;
    }

    public SessionResult run() {
        deadlineNanos = System.nanoTime() + settings.sessionTimeout().toNanos();
        waves = new WaveExecutor(session.capabilities(), settings.parallelism());
        MdcContext.setSession(state.sessionId());
        try {
            try {
                var graph = new LoopGraph(this::enter, this::step, session.checkpointSaver(), recursionLimit());
                graph.invoke(graphInputs(), LoopCheckpoints.config(state.sessionId()))
                        .ifPresent(end -> log.debug("Session {} graph trail: {}", state.sessionId(), end.trail()));
            } catch (Exception e) {
                graphFailed(e);
            }

            SessionResult result = buildResult();
            session.metrics().recordSessionResult(result.termination().name());
            session.metrics().recordIterationDepth(result.iterations());
            log.info("Session {} ended {} ({}) after {} iteration(s), {} replan(s): {}",
                    result.sessionId(), result.phase(), result.termination(), result.iterations(),
                    result.replans(), result.reason());
            publish(LoopEventType.SESSION_COMPLETED, Map.of(
                    "phase", result.phase().name(),
                    "termination", result.termination().name(),
                    "iterations", result.iterations()));
            return result;
        } finally {
            waves.shutdown();
            MdcContext.clear();
        }
    }

    private Map<String, Object> graphInputs() {
        var inputs = new HashMap<String, Object>();
        inputs.put(LoopGraphState.SESSION_ID, state.sessionId());
        inputs.put(LoopGraphState.GOAL, String.valueOf(state.goal()));
        inputs.put(LoopGraphState.PHASE, state.phase().name());
        inputs.put(LoopGraphState.ITERATION, state.iteration());
        inputs.put(LoopGraphState.REPLANS, state.replanCount());
        inputs.put(LoopCheckpoints.SNAPSHOT_KEY, LoopCheckpoints.encode(state.toSnapshot()));
        return inputs;
    }

    /** Upper bound on node runs: every wave visits at most four nodes, every replan two. */
    private int recursionLimit() {
        return 16 + 4 * settings.maxIterations() + 2 * settings.maxReplans();
    }

    /**
     * The graph itself stopped: a checkpoint could not be written, the recursion limit was
     * hit, or compilation failed. The session fails unless it had already finished.
     */
    private void graphFailed(Exception e) {
        Throwable cause = rootCause(e);
        if (state.phase().isTerminal()) {
            log.error("Loop graph for session {} failed after it ended {}", state.sessionId(), state.phase(), e);
            return;
        }
        log.error("Loop graph for session {} failed at {}", state.sessionId(), state.phase(), e);
        transition(fail(Termination.FAILED, "Graph execution failed: " + cause.getMessage(), cause));
    }

    private static Throwable rootCause(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause;
    }

    private Map<String, Object> enter(LoopGraphState graphState) {
        log.info("Session {} starting at {}: {}", state.sessionId(), state.phase(), state.goal());
        publish(LoopEventType.SESSION_STARTED, Map.of("goal", String.valueOf(state.goal()),
                "phase", state.phase().name()));
        publish(LoopEventType.PHASE_ENTERED, Map.of("phase", state.phase().name(), "iteration", state.iteration()));
        return update(LoopGraph.ENTER);
    }

    private Map<String, Object> step(LoopPhase phase, LoopGraphState graphState) {
        if (state.phase() != phase || !state.sessionId().equals(graphState.sessionId())) {
            throw new IllegalStateException("Graph " + graphState.sessionId() + " is at " + phase
                    + " but loop " + state.sessionId() + " is at " + state.phase());
        }
        lastRoute = null;
        transition(runPhase(phase));
        Map<String, Object> update = update(LoopGraph.nodeName(phase));
        if (phase == LoopPhase.VALIDATION) {
            GateDecision.Route route = state.phase() == LoopPhase.FAILED || lastRoute == null
                    ? GateDecision.Route.FAIL
                    : lastRoute;
            update.put(LoopGraphState.ROUTE, route.name());
        }
        return update;
    }

    /** Graph state after a node: the loop's scalars plus a full snapshot. */
    private Map<String, Object> update(String node) {
        var update = new HashMap<String, Object>();
        update.put(LoopGraphState.PHASE, state.phase().name());
        update.put(LoopGraphState.ITERATION, state.iteration());
        update.put(LoopGraphState.REPLANS, state.replanCount());
        update.put(LoopCheckpoints.SNAPSHOT_KEY, LoopCheckpoints.encode(state.toSnapshot()));
        update.put(LoopGraphState.TRAIL, List.of(node));
        return update;
    }

    private LoopPhase runPhase(LoopPhase phase) {
        try {
            return switch (phase) {
                case PLANNING -> plan();
                case EXECUTION -> execute();
                case OBSERVATION -> observe();
                case REFLECTION -> reflect();
                case VALIDATION -> validate();
                case REPLANNING -> replan();
                case DONE, FAILED -> phase;
            };
        } catch (PlanningException e) {
            return fail(Termination.FAILED, "Planning failed: " + e.getMessage(), e);
        } catch (GraphIntegrityException e) {
            return fail(Termination.FAILED, "Task graph integrity error: " + e.getMessage(), e);
        } catch (BudgetExceededException e) {
            return fail(Termination.FAILED, "Context budget exceeded: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("Unexpected error in phase {}", phase, e);
            return fail(Termination.FAILED, "Unexpected error in " + phase + ": " + e.getMessage(), e);
        }
    }

    private void transition(LoopPhase next) {
        log.info("{} -> {}", state.phase(), next);
        state.enter(next);
        publish(LoopEventType.PHASE_ENTERED, Map.of("phase", next.name(), "iteration", state.iteration()));
    }

    // -- PLANNING -------------------------------------------------------------

    private LoopPhase plan() {
        TaskGraph graph = state.stagedGraph();
        if (graph == null) {
            if (state.graph() == null && state.replanCount() == 0) {
                session.inputGuard().check(state.goal());
            }
            if (deadlinePassed()) {
                state.markTimedOut();
                return fail(Termination.FAILED, "session timeout before a plan was produced", null);
            }
            graph = PlanAssembler.assemble(state.goal(), callPlanner(null, null), null);
        } else {
            log.info("Installing replanned graph v{} ({} nodes)", graph.planVersion(), graph.size());
        }
        state.installGraph(graph);
        appendRound("planning", describePlan(graph));
        return LoopPhase.EXECUTION;
    }

    private TaskPlan callPlanner(TaskGraph prior, String feedback) {
        long start = System.currentTimeMillis();
        try {
            TaskPlan plan = session.planner().plan(new PlanningRequest(state.goal(),
                    state.context().effectiveView(), session.capabilityDescriptors(), prior, feedback));
            if (plan == null) {
                throw new PlanningException("Planner returned no plan");
            }
            return plan;
        } catch (PlanningException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PlanningException("Planner error: " + e.getMessage(), e);
        } finally {
            session.metrics().recordPlanningDuration(System.currentTimeMillis() - start, prior != null);
        }
    }

    // -- EXECUTION ------------------------------------------------------------

    private LoopPhase execute() {
        if (state.iteration() >= settings.maxIterations()) {
            return fail(Termination.MAX_ITERATIONS_EXCEEDED,
                    "Iteration cap " + settings.maxIterations() + " reached", null);
        }
        int wave = state.nextIteration();
        MdcContext.setIteration(state.sessionId(), wave);
        TaskGraph graph = state.graph();

        for (String id : graph.skipBlocked()) {
            log.info("Skipping node {}: {}", id, graph.get(id).error());
            publishTask(LoopEventType.TASK_SKIPPED, id, Map.of("reason", String.valueOf(graph.get(id).error())));
        }

        List<TaskNode> ready = graph.readyNodes();
        for (TaskNode node : ready) {
            graph.mark(node.id(), TaskStatus.READY, null);
        }

        if (deadlinePassed()) {
            state.markTimedOut();
            ready.forEach(node -> graph.mark(node.id(), TaskStatus.SKIPPED, "session timeout before dispatch"));
            state.setLastWave(List.of());
            log.warn("Session deadline passed; skipped {} ready node(s)", ready.size());
            return LoopPhase.OBSERVATION;
        }

        log.info("Wave {}: dispatching {} node(s) with parallelism {}", wave, ready.size(), settings.parallelism());
        session.metrics().recordWave(ready.size(), settings.parallelism() > 1);

        WaveReport report = waves.execute(state.sessionId(), ready, settings.nodeTimeout(), deadlineNanos, node -> {
            graph.mark(node.id(), TaskStatus.RUNNING, null);
            publishTask(LoopEventType.TASK_DISPATCHED, node.id(), Map.of("capability", node.capabilityRef()));
        });

        for (NodeOutcome outcome : report.outcomes()) {
            apply(graph, outcome);
        }
        for (String id : report.undispatched()) {
            graph.mark(id, TaskStatus.SKIPPED, "session timeout before dispatch");
        }
        if (report.sessionExpired()) {
            state.markTimedOut();
        }
        state.setLastWave(report.outcomes());
        return LoopPhase.OBSERVATION;
    }

    private void apply(TaskGraph graph, NodeOutcome outcome) {
        String id = outcome.nodeId();
        String tag;
        if (outcome.succeeded()) {
            graph.mark(id, TaskStatus.SUCCEEDED, outcome.output());
            publishTask(LoopEventType.TASK_SUCCEEDED, id, Map.of("capability", outcome.capabilityRef(),
                    "elapsedMs", outcome.elapsedMs()));
            tag = "succeeded";
        } else {
            TaskNode failed = graph.mark(id, TaskStatus.FAILED, outcome.error());
            tag = outcome.failureKind() == FailureKind.TIMEOUT ? "timeout" : "failed";
            if (outcome.retryable() && failed.retryCount() < settings.retryLimit()) {
                graph.resetForRetry(id);
                log.warn("Node {} failed (attempt {}/{}), will retry: {}",
                        id, failed.retryCount(), settings.retryLimit(), outcome.error());
                session.metrics().recordNodeRetry(outcome.capabilityRef());
                publishTask(LoopEventType.TASK_RETRYING, id, Map.of("attempt", failed.retryCount(),
                        "error", String.valueOf(outcome.error())));
            } else {
                log.warn("Node {} failed permanently after {} attempt(s): {}",
                        id, failed.retryCount(), outcome.error());
                publishTask(LoopEventType.TASK_FAILED, id, Map.of("attempts", failed.retryCount(),
                        "kind", outcome.failureKind().name(),
                        "error", String.valueOf(outcome.error())));
            }
        }
        session.metrics().recordNodeExecution(outcome.capabilityRef(), tag, outcome.elapsedMs());
    }

    // -- OBSERVATION / REFLECTION ---------------------------------------------

    private LoopPhase observe() {
        var sb = new StringBuilder("Wave ").append(state.iteration()).append(" results:\n");
        if (state.lastWave().isEmpty()) {
            sb.append("- no nodes dispatched\n");
        }
        for (NodeOutcome o : state.lastWave()) {
            sb.append("- ").append(o.nodeId()).append(" [").append(o.capabilityRef()).append("] ");
            if (o.succeeded()) {
                sb.append("succeeded: ").append(o.output());
            } else {
                sb.append("failed (").append(o.failureKind().name().toLowerCase()).append("): ").append(o.error());
            }
            sb.append('\n');
        }
        sb.append("Status: ").append(state.graph().statusCounts());
        appendRound("observation", sb.toString());

        boolean reflect = settings.enableReflection() && session.reflection().isPresent() && !state.timedOut();
        return reflect ? LoopPhase.REFLECTION : LoopPhase.VALIDATION;
    }

    private LoopPhase reflect() {
        Optional<String> note;
        try {
            note = session.reflection()
                    .flatMap(r -> r.reflect(state.goal(), state.context().effectiveView(), progress()));
        } catch (RuntimeException e) {
            log.warn("Reflection failed, continuing without a note: {}", e.getMessage());
            note = Optional.empty();
        }
        note.filter(n -> !n.isBlank()).ifPresent(n -> appendRound("reflection", n));
        return LoopPhase.VALIDATION;
    }

    // -- VALIDATION -----------------------------------------------------------

    private LoopPhase validate() {
        TaskGraph graph = state.graph();
        ValidationResult result;
        try {
            result = session.validator().validate(state.context().effectiveView(), latestResults());
            if (result == null) {
                result = ValidationResult.fail("validator", "Validator returned no result");
            }
        } catch (RuntimeException e) {
            log.warn("Validator threw, treating as failed validation: {}", e.getMessage());
            result = ValidationResult.fail("validator", "Validator error: " + e.getMessage());
        }
        state.setLastValidation(result);
        session.metrics().recordValidation(result.passed());

        GateDecision decision = ValidationGate.decide(result, graph.isTerminal(), graph.hasFailures(),
                graph.nodesWithStatus(TaskStatus.SKIPPED).size(), state.iteration(), state.replanCount(),
                state.timedOut(), settings.maxIterations(), settings.maxReplans(), settings.enableReplanning());
        log.info("Validation gate: {} ({})", decision.route(), decision.reason());
        lastRoute = decision.route();

        return switch (decision.route()) {
            case DONE -> {
                state.terminate(Termination.COMPLETED, decision.reason(), null);
                yield LoopPhase.DONE;
            }
            case CONTINUE -> LoopPhase.EXECUTION;
            case REPLAN -> LoopPhase.REPLANNING;
            case FAIL -> fail(decision.termination(), decision.reason(), null);
        };
    }

    // -- REPLANNING -----------------------------------------------------------

    private LoopPhase replan() {
        int pass = state.nextReplan();
        session.metrics().recordReplan();
        TaskGraph prior = state.graph();
        String feedback = feedback(state.lastValidation(), prior);
        if (deadlinePassed()) {
            state.markTimedOut();
            return fail(Termination.FAILED, "session timeout before replanning", null);
        }
        TaskGraph next = PlanAssembler.assemble(state.goal(), callPlanner(prior, feedback), prior);
        state.stage(next);
        appendRound("replanning", "Replanning pass " + pass + "\n" + feedback + "\n" + describePlan(next));
        return LoopPhase.PLANNING;
    }

    private static String feedback(ValidationResult validation, TaskGraph graph) {
        var sb = new StringBuilder("Validation feedback:\n");
        if (validation != null) {
            validation.violations().stream()
                    .filter(v -> v.severity() != Severity.INFO)
                    .forEach(v -> sb.append("- ").append(v.severity()).append(' ')
                            .append(v.ruleName()).append(": ").append(v.message()).append('\n'));
        }
        for (TaskNode node : graph.nodesWithStatus(TaskStatus.FAILED)) {
            sb.append("- failed node ").append(node.id()).append(" [").append(node.capabilityRef())
                    .append("]: ").append(node.error()).append('\n');
        }
        return sb.toString();
    }

    // -- helpers --------------------------------------------------------------

    private LoopPhase fail(Termination termination, String reason, Throwable cause) {
        state.terminate(termination, reason, cause);
        log.warn("Session {} failing ({}): {}", state.sessionId(), termination, reason);
        return LoopPhase.FAILED;
    }

    private void appendRound(String label, String content) {
        state.context().appendRound(label, content);
    }

    private void onLevelChanged(Round round) {
        session.metrics().recordCompression(round.lodLevel().name().toLowerCase());
        publish(LoopEventType.CONTEXT_COMPRESSED, Map.of("round", round.index(), "level", round.lodLevel().name()));
    }

    private List<NodeResult> progress() {
        TaskGraph graph = state.graph();
        return graph == null ? List.of() : graph.nodes().stream().map(NodeResult::of).toList();
    }

    /**
     * What the validator judges: nodes touched by the latest wave plus every permanently failed
     * node of the current graph. Succeeded nodes carried over from an earlier wave or plan were
     * judged when they ran.
     */
    private List<NodeResult> latestResults() {
        TaskGraph graph = state.graph();
        if (graph == null) {
            return List.of();
        }
        Set<String> ids = new LinkedHashSet<>();
        state.lastWave().forEach(outcome -> ids.add(outcome.nodeId()));
        graph.nodesWithStatus(TaskStatus.FAILED).forEach(node -> ids.add(node.id()));
        return ids.stream()
                .filter(graph::contains)
                .map(id -> NodeResult.of(graph.get(id)))
                .toList();
    }

    private boolean deadlinePassed() {
        return System.nanoTime() - deadlineNanos >= 0;
    }

    private void publish(LoopEventType type, Map<String, Object> payload) {
        session.eventBus().publish(LoopEvent.session(type, state.sessionId(), payload));
    }

    private void publishTask(LoopEventType type, String taskId, Map<String, Object> payload) {
        session.eventBus().publish(LoopEvent.task(type, state.sessionId(), taskId, payload));
    }

    private static String describePlan(TaskGraph graph) {
        var sb = new StringBuilder("Plan v").append(graph.planVersion()).append(" for: ").append(graph.goal()).append('\n');
        for (TaskNode node : graph.nodes()) {
            sb.append("- ").append(node.id()).append(" [").append(node.capabilityRef()).append("] ")
                    .append(node.description());
            if (!node.dependencies().isEmpty()) {
                sb.append(" (after ").append(String.join(", ", node.dependencies())).append(')');
            }
            if (node.status() == TaskStatus.SUCCEEDED) {
                sb.append(" (done)");
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private SessionResult buildResult() {
        List<NodeResult> nodes = progress();
        var succeeded = new LinkedHashMap<String, String>();
        for (NodeResult node : nodes) {
            if (node.status() == TaskStatus.SUCCEEDED) {
                succeeded.put(node.nodeId(), node.output());
            }
        }
        return new SessionResult(state.sessionId(), state.phase(), state.termination(), state.reason(),
                state.failureCause(), state.iteration(), state.replanCount(), nodes,
                Collections.unmodifiableMap(succeeded), state.lastValidation(),
                state.context().effectiveView().render(), state.phaseHistory());
    }
}
