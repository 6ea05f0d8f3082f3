package com.agentloop.core.engine;

import com.agentloop.core.model.LoopPhase;
import com.agentloop.core.persistence.LoopCheckpoints;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LoopGraphTest {

    private static LoopGraphState state(Map<String, Object> values) {
        return new LoopGraphState(values);
    }

    /** Moves through a scripted list of (phase entered, gate route) pairs, one per node. */
    private static LoopGraph.PhaseStep scripted(String... nextPhases) {
        Deque<String> script = new ArrayDeque<>(List.of(nextPhases));
        return (phase, graphState) -> {
            String[] next = script.removeFirst().split(":");
            var update = new HashMap<String, Object>();
            update.put(LoopGraphState.PHASE, next[0]);
            update.put(LoopGraphState.TRAIL, List.of(LoopGraph.nodeName(phase)));
            if (next.length > 1) {
                update.put(LoopGraphState.ROUTE, next[1]);
            }
            return update;
        };
    }

    private static Map<String, Object> enterUpdate(LoopGraphState graphState) {
        return Map.of(LoopGraphState.TRAIL, List.of(LoopGraph.ENTER));
    }

    @Nested
    @DisplayName("routing")
    class Routing {

        @Test
        @DisplayName("phase nodes route to the phase they entered")
        void routeByPhase() {
            assertEquals("execution", LoopGraph.routeByPhase(state(Map.of(LoopGraphState.PHASE, "EXECUTION"))));
            assertEquals("failed", LoopGraph.routeByPhase(state(Map.of(LoopGraphState.PHASE, "FAILED"))));
        }

        @Test
        @DisplayName("validation follows the gate route and fails without one")
        void routeAfterValidation() {
            assertEquals("REPLAN", LoopGraph.routeAfterValidation(state(Map.of(
                    LoopGraphState.PHASE, "REPLANNING", LoopGraphState.ROUTE, "REPLAN"))));
            assertEquals("FAIL", LoopGraph.routeAfterValidation(state(Map.of(
                    LoopGraphState.PHASE, "FAILED", LoopGraphState.ROUTE, "CONTINUE"))));
            assertEquals("FAIL", LoopGraph.routeAfterValidation(state(Map.of(LoopGraphState.PHASE, "DONE"))));
        }
    }

    @Test
    @DisplayName("state reads its scalars back and fills in channel defaults")
    void stateAccessors() {
        LoopGraphState filled = state(Map.of(LoopGraphState.SESSION_ID, "S-1", LoopGraphState.GOAL, "ship it",
                LoopGraphState.PHASE, "REFLECTION", LoopGraphState.ITERATION, 3, LoopGraphState.REPLANS, 1L,
                LoopCheckpoints.SNAPSHOT_KEY, "{}"));
        assertEquals("S-1", filled.sessionId());
        assertEquals("ship it", filled.goal());
        assertEquals(LoopPhase.REFLECTION, filled.phase());
        assertEquals(3, filled.iteration());
        assertEquals(1, filled.replans());
        assertEquals("{}", filled.snapshot());

        LoopGraphState empty = state(Map.of());
        assertEquals(LoopPhase.PLANNING, empty.phase());
        assertEquals("", empty.route());
        assertTrue(empty.trail().isEmpty());
    }

    @Test
    @DisplayName("a reflect, replan and finish run visits the nodes in loop order")
    void fullLoop() throws Exception {
        var graph = new LoopGraph(LoopGraphTest::enterUpdate, scripted(
                "EXECUTION", "OBSERVATION", "REFLECTION", "VALIDATION", "REPLANNING:REPLAN",
                "PLANNING", "EXECUTION", "OBSERVATION", "VALIDATION", "DONE:DONE"), null, 50);

        LoopGraphState end = graph.invoke(Map.of(LoopGraphState.PHASE, "PLANNING"),
                LoopCheckpoints.config("G-1")).orElseThrow();

        assertEquals(List.of("enter", "planning", "execution", "observation", "reflection", "validation",
                "replanning", "planning", "execution", "observation", "validation"), end.trail());
        assertEquals(LoopPhase.DONE, end.phase());
    }

    @Test
    @DisplayName("a continue route runs another wave")
    void continueRunsAnotherWave() throws Exception {
        var graph = new LoopGraph(LoopGraphTest::enterUpdate, scripted(
                "OBSERVATION", "VALIDATION", "EXECUTION:CONTINUE", "OBSERVATION", "VALIDATION", "FAILED:FAIL"),
                null, 50);

        LoopGraphState end = graph.invoke(Map.of(LoopGraphState.PHASE, "EXECUTION"),
                LoopCheckpoints.config("G-2")).orElseThrow();

        assertEquals(List.of("enter", "execution", "observation", "validation", "execution", "observation",
                "validation"), end.trail());
        assertEquals(LoopPhase.FAILED, end.phase());
    }

    @Test
    @DisplayName("entering at a resumed phase skips the earlier nodes, entering finished ends at once")
    void resumedEntry() throws Exception {
        var graph = new LoopGraph(LoopGraphTest::enterUpdate, scripted("DONE:DONE"), null, 50);

        LoopGraphState resumed = graph.invoke(Map.of(LoopGraphState.PHASE, "VALIDATION"),
                LoopCheckpoints.config("G-3")).orElseThrow();
        assertEquals(List.of("enter", "validation"), resumed.trail());

        LoopGraphState finished = graph.invoke(Map.of(LoopGraphState.PHASE, "DONE"),
                LoopCheckpoints.config("G-4")).orElseThrow();
        assertEquals(List.of("enter"), finished.trail());
    }

    @Test
    @DisplayName("with a saver every node leaves a checkpoint under the session id")
    void checkpointsPerNode() throws Exception {
        var saver = new MemorySaver();
        var graph = new LoopGraph(LoopGraphTest::enterUpdate, scripted(
                "EXECUTION", "OBSERVATION", "VALIDATION", "DONE:DONE"), saver, 50);

        graph.invoke(Map.of(LoopGraphState.PHASE, "PLANNING"), LoopCheckpoints.config("G-5"));

        var checkpoints = saver.list(LoopCheckpoints.config("G-5"));
        assertTrue(checkpoints.size() >= 5, "checkpoints: " + checkpoints.size());
        Checkpoint latest = saver.get(LoopCheckpoints.config("G-5")).orElseThrow();
        assertEquals("DONE", latest.getState().get(LoopGraphState.PHASE));
        assertTrue(saver.list(LoopCheckpoints.config("G-6")).isEmpty());
    }
}
