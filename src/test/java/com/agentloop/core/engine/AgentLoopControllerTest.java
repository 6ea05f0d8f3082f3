package com.agentloop.core.engine;

import com.agentloop.core.capability.CapabilityKind;
import com.agentloop.core.capability.CapabilityRegistry;
import com.agentloop.core.context.ContextSettings;
import com.agentloop.core.events.EventBus;
import com.agentloop.core.events.LoopEvent;
import com.agentloop.core.model.LoopPhase;
import com.agentloop.core.model.NodeResult;
import com.agentloop.core.model.SessionResult;
import com.agentloop.core.model.TaskPlan;
import com.agentloop.core.model.TaskPlan.PlannedStep;
import com.agentloop.core.model.TaskStatus;
import com.agentloop.core.model.Termination;
import com.agentloop.core.model.ValidationResult;
import com.agentloop.core.persistence.LoopCheckpoints;
import com.agentloop.core.persistence.LoopSnapshot;
import com.agentloop.core.planning.PlanningPort;
import com.agentloop.core.planning.PlanningRequest;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AgentLoopControllerTest {

    /** Hands out plans in order and records every request it saw. */
    static class ScriptedPlanner implements PlanningPort {
        final Deque<TaskPlan> plans = new ArrayDeque<>();
        final List<PlanningRequest> requests = new ArrayList<>();

        ScriptedPlanner then(PlannedStep... steps) {
            plans.addLast(new TaskPlan("scripted", List.of(steps)));
            return this;
        }

        @Override
        public TaskPlan plan(PlanningRequest request) {
            requests.add(request);
            if (plans.isEmpty()) {
                throw new IllegalStateException("no more plans");
            }
            return plans.removeFirst();
        }
    }

    private static PlannedStep step(String id, String capability, String... deps) {
        return new PlannedStep(id, "step " + id, capability, Map.of("text", id), List.of(deps));
    }

    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private CapabilityRegistry registry;
    private ScriptedPlanner planner;

    private int callsTo(String nodeText) {
        return calls.getOrDefault(nodeText, new AtomicInteger()).get();
    }

    @BeforeEach
    void setUp() {
        planner = new ScriptedPlanner();
        registry = new CapabilityRegistry()
                .register("echo", CapabilityKind.FUNCTION, "echoes its text", args -> {
                    calls.computeIfAbsent(args.get("text"), k -> new AtomicInteger()).incrementAndGet();
                    return "echo output for " + args.get("text");
                })
                .register("broken", CapabilityKind.PROTOCOL_TOOL, "always fails", args -> {
                    calls.computeIfAbsent(args.get("text"), k -> new AtomicInteger()).incrementAndGet();
                    throw new IllegalStateException("tool unavailable");
                })
                .register("slow", CapabilityKind.SUBAGENT, "takes forever", args -> {
                    Thread.sleep(5_000);
                    return "too late";
                });
    }

    private LoopSettings.Builder settings() {
        return LoopSettings.builder()
                .nodeTimeout(Duration.ofSeconds(5))
                .sessionTimeout(Duration.ofSeconds(30));
    }

    private SessionContext.Builder context(LoopSettings settings) {
        return SessionContext.builder("LOOP-TEST-0001")
                .settings(settings)
                .planner(planner)
                .capabilities(registry)
                .capabilityDescriptors(registry.descriptors());
    }

    private SessionResult run(SessionContext.Builder context, String goal) {
        return new AgentLoopController(context.build(), goal).run();
    }

    @Nested
    @DisplayName("successful sessions")
    class Successful {

        @Test
        @DisplayName("runs a dependent pair in two waves and ends done")
        void dependentPair() {
            planner.then(step("A", "echo"), step("B", "echo", "A"));

            SessionResult result = run(context(settings().build()), "write a report");

            assertTrue(result.completed());
            assertEquals(Termination.COMPLETED, result.termination());
            assertEquals(2, result.iterations());
            assertEquals(0, result.replans());
            assertEquals(List.of("A", "B"), List.copyOf(result.succeededResults().keySet()));
            assertEquals("echo output for B", result.succeededResults().get("B"));
            assertEquals(List.of(LoopPhase.PLANNING, LoopPhase.EXECUTION, LoopPhase.OBSERVATION,
                    LoopPhase.VALIDATION, LoopPhase.EXECUTION, LoopPhase.OBSERVATION,
                    LoopPhase.VALIDATION, LoopPhase.DONE), result.phaseHistory());
            assertTrue(result.effectiveView().contains("Plan v1"));
            assertTrue(result.lastValidation().passed());
        }

        @Test
        @DisplayName("the planner sees the goal and the registered capabilities")
        void plannerRequest() {
            planner.then(step("A", "echo"));

            run(context(settings().build()), "summarize");

            PlanningRequest request = planner.requests.get(0);
            assertEquals("summarize", request.goal());
            assertFalse(request.replanning());
            assertEquals(List.of("echo", "broken", "slow"),
                    request.capabilities().stream().map(c -> c.name()).toList());
        }

        @Test
        @DisplayName("reflection notes are added to the context and a failing reflector is ignored")
        void reflection() {
            planner.then(step("A", "echo"));
            SessionResult withNote = run(context(settings().enableReflection(true).build())
                    .reflector((goal, view, progress) -> Optional.of("remember the units")), "measure");

            assertTrue(withNote.completed());
            assertTrue(withNote.phaseHistory().contains(LoopPhase.REFLECTION));
            assertTrue(withNote.effectiveView().contains("remember the units"));

            planner.then(step("A", "echo"));
            SessionResult withError = run(context(settings().enableReflection(true).build())
                    .reflector((goal, view, progress) -> {
                        throw new IllegalStateException("model offline");
                    }), "measure");

            assertTrue(withError.completed());
        }

        @Test
        @DisplayName("reflection is skipped when disabled even if a reflector exists")
        void reflectionDisabled() {
            planner.then(step("A", "echo"));

            SessionResult result = run(context(settings().build())
                    .reflector((goal, view, progress) -> Optional.of("never")), "measure");

            assertFalse(result.phaseHistory().contains(LoopPhase.REFLECTION));
        }
    }

    @Nested
    @DisplayName("retries and replanning")
    class Replanning {

        @Test
        @DisplayName("a node failing three times with retry limit 3 leads to replanning, not failure")
        void retryLimitThenReplan() {
            planner.then(step("X", "broken"))
                    .then(step("Y", "echo"));

            SessionResult result = run(context(settings().retryLimit(3).enableReplanning(true).build()), "fix it");

            assertEquals(3, callsTo("X"));
            List<LoopPhase> history = result.phaseHistory();
            int replanAt = history.indexOf(LoopPhase.REPLANNING);
            assertTrue(replanAt > 0);
            assertEquals(LoopPhase.VALIDATION, history.get(replanAt - 1));
            assertEquals(3, Collections.frequency(history.subList(0, replanAt), LoopPhase.EXECUTION));

            PlanningRequest replanRequest = planner.requests.get(1);
            assertTrue(replanRequest.replanning());
            NodeResult x = NodeResult.of(replanRequest.priorGraph().get("X"));
            assertEquals(TaskStatus.FAILED, x.status());
            assertEquals(3, x.retryCount());
            assertTrue(replanRequest.feedback().contains("failed-nodes"));

            assertTrue(result.completed());
            assertEquals(1, result.replans());
        }

        @Test
        @DisplayName("replanning never runs a node that already succeeded")
        void succeededNodesNotRerun() {
            planner.then(step("A", "echo"), step("B", "broken", "A"))
                    .then(step("A", "echo"), step("C", "echo", "A"));

            SessionResult result = run(context(settings().retryLimit(1).build()), "build");

            assertTrue(result.completed());
            assertEquals(1, callsTo("A"));
            assertEquals(1, callsTo("C"));
            assertEquals(Map.of("A", "echo output for A", "C", "echo output for C"), result.succeededResults());
        }

        @Test
        @DisplayName("with replanning disabled a permanent failure fails the session but keeps partial results")
        void partialResults() {
            planner.then(step("A", "echo"), step("B", "broken"));

            SessionResult result = run(context(settings().retryLimit(1).enableReplanning(false).build()), "build");

            assertEquals(LoopPhase.FAILED, result.phase());
            assertEquals(Termination.FAILED, result.termination());
            assertTrue(result.reason().startsWith("Replanning disabled"));
            assertEquals(Map.of("A", "echo output for A"), result.succeededResults());
        }

        @Test
        @DisplayName("running out of replanning passes fails the session")
        void replanCap() {
            planner.then(step("X", "broken"))
                    .then(step("Y", "broken"));

            SessionResult result = run(context(settings().retryLimit(1).maxReplans(1).build()), "build");

            assertEquals(LoopPhase.FAILED, result.phase());
            assertEquals(1, result.replans());
            assertTrue(result.reason().startsWith("Replanning cap 1 reached"));
        }

        @Test
        @DisplayName("an empty output judged in one wave is not judged again once the replan carries it")
        void carriedNodesNotRevalidated() {
            AtomicInteger blankCalls = new AtomicInteger();
            registry.register("blank", CapabilityKind.FUNCTION, "returns nothing", args -> {
                blankCalls.incrementAndGet();
                return "";
            });
            planner.then(step("A", "blank"))
                    .then(step("A", "blank"), step("B", "echo", "A"));

            SessionResult result = run(context(settings().build()), "summarize");

            assertEquals(LoopPhase.DONE, result.phase());
            assertTrue(result.completed());
            assertEquals(1, result.replans());
            assertEquals(1, blankCalls.get());
            assertEquals(1, callsTo("B"));
        }

        @Test
        @DisplayName("dependents of a permanently failed node are skipped")
        void blockedNodesSkipped() {
            planner.then(step("A", "broken"), step("B", "echo", "A"));

            SessionResult result = run(context(settings().retryLimit(1).enableReplanning(false).build())
                    .validator((view, results) -> ValidationResult.pass()), "build");

            assertEquals(LoopPhase.FAILED, result.phase());
            NodeResult b = result.nodes().stream().filter(n -> n.nodeId().equals("B")).findFirst().orElseThrow();
            assertEquals(TaskStatus.SKIPPED, b.status());
            assertEquals("blocked by A", b.error());
            assertEquals(0, callsTo("B"));
        }
    }

    @Nested
    @DisplayName("failing sessions")
    class Failing {

        @Test
        @DisplayName("max iterations 1 with a validator that never passes fails after one cycle")
        void iterationCap() {
            planner.then(step("A", "echo"));

            SessionResult result = run(context(settings().maxIterations(1).build())
                    .validator((view, results) -> ValidationResult.fail("strict", "never good enough")), "try");

            assertEquals(LoopPhase.FAILED, result.phase());
            assertEquals(Termination.MAX_ITERATIONS_EXCEEDED, result.termination());
            assertEquals(1, result.iterations());
            assertEquals(1, planner.requests.size());
            assertEquals(List.of(LoopPhase.PLANNING, LoopPhase.EXECUTION, LoopPhase.OBSERVATION,
                    LoopPhase.VALIDATION, LoopPhase.FAILED), result.phaseHistory());
        }

        @Test
        @DisplayName("a planner error fails the session with the cause recorded")
        void plannerError() {
            PlanningPort exploding = request -> {
                throw new IllegalStateException("model quota exhausted");
            };

            SessionResult result = run(context(settings().build()).planner(exploding), "anything");

            assertEquals(LoopPhase.FAILED, result.phase());
            assertTrue(result.reason().startsWith("Planning failed"));
            assertTrue(result.failureCause().startsWith("PlanningException"));
            assertTrue(result.succeededResults().isEmpty());
        }

        @Test
        @DisplayName("a cyclic plan fails the session as a graph integrity error")
        void cyclicPlan() {
            planner.then(step("A", "echo", "B"), step("B", "echo", "A"));

            SessionResult result = run(context(settings().build()), "loop forever");

            assertEquals(LoopPhase.FAILED, result.phase());
            assertTrue(result.failureCause().startsWith("CycleException"));
        }

        @Test
        @DisplayName("a rejected goal never reaches the planner")
        void rejectedGoal() {
            SessionResult result = run(context(settings().build()), "  ");

            assertEquals(LoopPhase.FAILED, result.phase());
            assertTrue(planner.requests.isEmpty());
        }

        @Test
        @DisplayName("a context budget violation surfaces as a failure, not a truncation")
        void budgetExceeded() {
            planner.then(step("A", "echo"));

            SessionResult result = run(context(settings().build())
                    .contextSettings(new ContextSettings(10, 0.8, 4, 5))
                    .summarizer((raw, budget) -> "y".repeat(1_000)), "plan something long enough");

            assertEquals(LoopPhase.FAILED, result.phase());
            assertTrue(result.failureCause().startsWith("BudgetExceededException"));
        }

        @Test
        @DisplayName("a session timeout that skips every ready node says so in the done reason")
        void timeoutBeforeDispatch() {
            PlanningPort slowPlanner = request -> {
                try {
                    Thread.sleep(400);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return new TaskPlan("scripted", List.of(step("A", "echo")));
            };

            SessionResult result = run(context(settings().sessionTimeout(Duration.ofMillis(200)).build())
                    .planner(slowPlanner), "hurry");

            assertEquals(0, callsTo("A"));
            assertEquals(TaskStatus.SKIPPED, result.nodes().get(0).status());
            assertTrue(result.reason().contains("1 node(s) skipped after session timeout"), result.reason());
            assertFalse(result.reason().startsWith("All nodes finished"));
        }

        @Test
        @DisplayName("a session timeout cancels in-flight work and still terminates")
        void sessionTimeout() {
            planner.then(step("A", "slow"));
            long start = System.currentTimeMillis();

            SessionResult result = run(context(settings()
                    .nodeTimeout(Duration.ofSeconds(10))
                    .sessionTimeout(Duration.ofMillis(300))
                    .build()), "wait");

            assertTrue(System.currentTimeMillis() - start < 4_000);
            assertEquals(LoopPhase.FAILED, result.phase());
            assertEquals("session timeout", result.reason());
            NodeResult a = result.nodes().get(0);
            assertEquals(TaskStatus.FAILED, a.status());
        }
    }

    @Nested
    @DisplayName("events and checkpoints")
    class EventsAndCheckpoints {

        @Test
        @DisplayName("publishes the session lifecycle on the event bus")
        void events() {
            planner.then(step("A", "echo"));
            var bus = new EventBus();
            var types = Collections.synchronizedList(new ArrayList<String>());
            bus.subscribe("LOOP-TEST-0001", e -> types.add(e.eventType()));

            run(context(settings().build()).eventBus(bus), "go");

            assertEquals("session.started", types.get(0));
            assertEquals("session.completed", types.get(types.size() - 1));
            assertTrue(types.contains("task.dispatched"));
            assertTrue(types.contains("task.succeeded"));
            assertTrue(types.contains("phase.entered"));
        }

        @Test
        @DisplayName("a retried node publishes a retry event before its permanent failure")
        void retryEvents() {
            planner.then(step("X", "broken"));
            var bus = new EventBus();
            var events = Collections.synchronizedList(new ArrayList<LoopEvent>());
            bus.subscribeAll(events::add);

            run(context(settings().retryLimit(2).enableReplanning(false).build()).eventBus(bus), "go");

            List<String> taskEvents = events.stream()
                    .filter(e -> "X".equals(e.taskId()))
                    .map(LoopEvent::eventType)
                    .toList();
            assertEquals(List.of("task.dispatched", "task.retrying", "task.dispatched", "task.failed"), taskEvents);
        }

        @Test
        @DisplayName("the graph checkpoints after every phase node, ending with the final state")
        void checkpointsPerNode() {
            planner.then(step("A", "echo"));
            var saver = new MemorySaver();

            SessionResult result = run(context(settings().build()).checkpointSaver(saver), "go");

            LoopSnapshot last = LoopCheckpoints.latest(saver, "LOOP-TEST-0001").orElseThrow();
            assertEquals(LoopPhase.DONE, last.phase());
            assertEquals(result.phaseHistory(), last.phaseHistory());

            var phases = new ArrayList<LoopPhase>();
            for (LoopSnapshot snapshot : LoopCheckpoints.history(saver, "LOOP-TEST-0001")) {
                if (phases.isEmpty() || phases.get(phases.size() - 1) != snapshot.phase()) {
                    phases.add(snapshot.phase());
                }
            }
            assertEquals(List.of(LoopPhase.PLANNING, LoopPhase.EXECUTION, LoopPhase.OBSERVATION,
                    LoopPhase.VALIDATION, LoopPhase.DONE), phases);
        }

        @Test
        @DisplayName("a checkpoint saver that cannot write fails the session with its cause")
        void failingSaver() {
            planner.then(step("A", "echo"));
            BaseCheckpointSaver broken = new BaseCheckpointSaver() {
                @Override
                public Collection<Checkpoint> list(RunnableConfig config) {
                    return List.of();
                }

                @Override
                public Optional<Checkpoint> get(RunnableConfig config) {
                    return Optional.empty();
                }

                @Override
                public RunnableConfig put(RunnableConfig config, Checkpoint checkpoint) throws Exception {
                    throw new IllegalStateException("disk full");
                }

                @Override
                public Tag release(RunnableConfig config) throws Exception {
                    return new Tag(config.threadId().orElse(THREAD_ID_DEFAULT), List.of());
                }
            };
            var bus = new EventBus();
            var types = Collections.synchronizedList(new ArrayList<String>());
            bus.subscribe("LOOP-TEST-0001", e -> types.add(e.eventType()));

            SessionResult result = run(context(settings().build()).checkpointSaver(broken).eventBus(bus), "go");

            assertEquals(LoopPhase.FAILED, result.phase());
            assertEquals(Termination.FAILED, result.termination());
            assertTrue(result.reason().startsWith("Graph execution failed"), result.reason());
            assertTrue(result.reason().contains("disk full"), result.reason());
            assertEquals(0, callsTo("A"));
            assertEquals("session.completed", types.get(types.size() - 1));
        }

        @Test
        @DisplayName("resuming from a mid-session checkpoint finishes without redoing finished work")
        void resumeFromSnapshot() {
            planner.then(step("A", "echo"), step("B", "echo", "A"));
            var saver = new MemorySaver();
            SessionResult original = run(context(settings().build()).checkpointSaver(saver), "report");
            LoopSnapshot afterFirstWave = LoopCheckpoints.history(saver, "LOOP-TEST-0001").stream()
                    .filter(s -> s.phase() == LoopPhase.VALIDATION)
                    .findFirst()
                    .orElseThrow();
            calls.clear();

            PlanningPort mustNotPlan = request -> {
                throw new AssertionError("resumed session must not plan again");
            };
            SessionResult resumed = AgentLoopController
                    .resume(context(settings().build()).planner(mustNotPlan).build(), afterFirstWave)
                    .run();

            assertTrue(resumed.completed());
            assertEquals(0, callsTo("A"));
            assertEquals(1, callsTo("B"));
            assertEquals(original.succeededResults(), resumed.succeededResults());
            assertEquals(original.iterations(), resumed.iterations());
        }

        @Test
        @DisplayName("resume refuses a snapshot from another session")
        void resumeWrongSession() {
            planner.then(step("A", "echo"));
            var saver = new MemorySaver();
            run(context(settings().build()).checkpointSaver(saver), "go");
            LoopSnapshot snapshot = LoopCheckpoints.latest(saver, "LOOP-TEST-0001").orElseThrow();

            SessionContext other = SessionContext.builder("LOOP-OTHER").planner(planner).capabilities(registry).build();

            assertThrows(IllegalArgumentException.class, () -> AgentLoopController.resume(other, snapshot));
        }
    }
}
