package com.agentloop.core.engine;

import com.agentloop.core.capability.CapabilityRegistry;
import com.agentloop.core.context.ContextSettings;
import com.agentloop.core.context.SummarizationPort;
import com.agentloop.core.events.EventBus;
import com.agentloop.core.logging.MdcContext;
import com.agentloop.core.metrics.AgentLoopMetrics;
import com.agentloop.core.model.SessionResult;
import com.agentloop.core.persistence.LoopCheckpoints;
import com.agentloop.core.planning.PlanningPort;
import com.agentloop.core.planning.ReflectionPort;
import com.agentloop.core.validation.InputGuard;
import com.agentloop.core.validation.ValidationPort;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for running sessions. Assembles a fresh {@link SessionContext} per session
 * from the application's ports and settings and hands it to a new {@link AgentLoopController}.
 */
@Service
public class SessionEngine {

    private static final Logger log = LoggerFactory.getLogger(SessionEngine.class);
    private static final AtomicInteger SESSION_COUNTER = new AtomicInteger(0);

    private final PlanningPort planner;
    private final CapabilityRegistry capabilities;
    private final ValidationPort validator;
    private final ReflectionPort reflector;
    private final SummarizationPort summarizer;
    private final InputGuard inputGuard;
    private final BaseCheckpointSaver checkpointSaver;
    private final EventBus eventBus;
    private final AgentLoopMetrics metrics;
    private final LoopSettings settings;
    private final ContextSettings contextSettings;

    public SessionEngine(PlanningPort planner, CapabilityRegistry capabilities, ValidationPort validator,
                         @Autowired(required = false) ReflectionPort reflector,
                         SummarizationPort summarizer, InputGuard inputGuard, BaseCheckpointSaver checkpointSaver,
                         EventBus eventBus, AgentLoopMetrics metrics,
                         LoopSettings settings, ContextSettings contextSettings) {
        this.planner = planner;
        this.capabilities = capabilities;
        this.validator = validator;
        this.reflector = reflector;
        this.summarizer = summarizer;
        this.inputGuard = inputGuard;
        this.checkpointSaver = checkpointSaver;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.settings = settings;
        this.contextSettings = contextSettings;
    }

    /**
     * Runs a new session for {@code goal} under a freshly generated id.
     */
    public SessionResult run(String goal) {
        return run(generateSessionId(), goal);
    }

    public SessionResult run(String sessionId, String goal) {
        MdcContext.setSession(sessionId);
        try {
            log.info("Starting session {} (maxIterations={}, parallel={}, reflection={}) - goal: {}",
                    sessionId, settings.maxIterations(), settings.parallelExecution(),
                    settings.enableReflection(), goal);
            return new AgentLoopController(contextFor(sessionId), goal).run();
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Continues a session from its latest checkpoint.
     *
     * @return empty when the saver holds no checkpoint for the session
     */
    public Optional<SessionResult> resume(String sessionId) {
        MdcContext.setSession(sessionId);
        try {
            return LoopCheckpoints.latest(checkpointSaver, sessionId)
                    .map(snapshot -> AgentLoopController.resume(contextFor(sessionId), snapshot).run());
        } finally {
            MdcContext.clear();
        }
    }

    SessionContext contextFor(String sessionId) {
        return SessionContext.builder(sessionId)
                .settings(settings)
                .contextSettings(contextSettings)
                .planner(planner)
                .capabilities(capabilities)
                .capabilityDescriptors(capabilities.descriptors())
                .validator(validator)
                .reflector(reflector)
                .summarizer(summarizer)
                .inputGuard(inputGuard)
                .checkpointSaver(checkpointSaver)
                .eventBus(eventBus)
                .metrics(metrics)
                .build();
    }

    /**
     * Generates a unique session id in the format LOOP-YYYY-NNNN.
     */
    public String generateSessionId() {
        int count = SESSION_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("LOOP-%d-%04d", year, count);
    }
}
