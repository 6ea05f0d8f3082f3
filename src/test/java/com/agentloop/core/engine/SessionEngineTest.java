package com.agentloop.core.engine;

import com.agentloop.core.capability.CapabilityKind;
import com.agentloop.core.capability.CapabilityRegistry;
import com.agentloop.core.context.ContextSettings;
import com.agentloop.core.context.TruncatingSummarizer;
import com.agentloop.core.events.EventBus;
import com.agentloop.core.metrics.AgentLoopMetrics;
import com.agentloop.core.model.LoopPhase;
import com.agentloop.core.model.SessionResult;
import com.agentloop.core.model.TaskPlan;
import com.agentloop.core.planning.PlanningPort;
import com.agentloop.core.validation.InputGuard;
import com.agentloop.core.validation.RuleBasedValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SessionEngineTest {

    private PlanningPort planner;
    private MemorySaver saver;
    private SimpleMeterRegistry meterRegistry;
    private SessionEngine engine;

    @BeforeEach
    void setUp() {
        planner = mock(PlanningPort.class);
        when(planner.plan(any())).thenReturn(new TaskPlan("single step", List.of(
                new TaskPlan.PlannedStep("A", "say hello", "greet", Map.of(), List.of()))));
        var registry = new CapabilityRegistry()
                .register("greet", CapabilityKind.FUNCTION, "greets", args -> "hello from the greeter");
        saver = new MemorySaver();
        meterRegistry = new SimpleMeterRegistry();
        engine = new SessionEngine(planner, registry, RuleBasedValidator.defaults(), null,
                new TruncatingSummarizer(), new InputGuard(1_000), saver, new EventBus(),
                new AgentLoopMetrics(meterRegistry), LoopSettings.defaults(), ContextSettings.defaults());
    }

    @Test
    @DisplayName("run generates a LOOP id and completes the session")
    void runGeneratesId() {
        SessionResult result = engine.run("greet the user");

        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        assertTrue(result.sessionId().matches("LOOP-" + year + "-\\d{4}"), result.sessionId());
        assertTrue(result.completed());
        assertEquals("hello from the greeter", result.succeededResults().get("A"));
        verify(planner, times(1)).plan(any());
    }

    @Test
    @DisplayName("generated ids are unique")
    void idsAreUnique() {
        assertNotEquals(engine.generateSessionId(), engine.generateSessionId());
    }

    @Test
    @DisplayName("records the session result metric and clears the MDC afterwards")
    void metricsAndMdc() {
        engine.run("S-1", "greet the user");

        assertEquals(1.0, meterRegistry.get("agentloop.sessions.total")
                .tag("termination", "COMPLETED").counter().count());
        assertNull(MDC.get("sessionId"));
    }

    @Test
    @DisplayName("resume returns empty for an unknown session")
    void resumeUnknown() {
        assertTrue(engine.resume("NOPE").isEmpty());
    }

    @Test
    @DisplayName("resume picks up the latest checkpoint of a session")
    void resumeKnown() {
        engine.run("S-2", "greet the user");

        SessionResult resumed = engine.resume("S-2").orElseThrow();

        assertEquals(LoopPhase.DONE, resumed.phase());
        assertEquals("hello from the greeter", resumed.succeededResults().get("A"));
        verify(planner, times(1)).plan(any());
    }

    @Test
    @DisplayName("each session gets its own context built from the shared ports")
    void contextPerSession() {
        SessionContext first = engine.contextFor("S-3");
        SessionContext second = engine.contextFor("S-4");

        assertEquals("S-3", first.sessionId());
        assertSame(first.planner(), second.planner());
        assertTrue(first.reflection().isEmpty());
        assertEquals(List.of("greet"), first.capabilityDescriptors().stream().map(d -> d.name()).toList());
        assertSame(saver, first.checkpointSaver());
    }
}
