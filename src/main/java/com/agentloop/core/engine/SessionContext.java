package com.agentloop.core.engine;

import com.agentloop.core.capability.CapabilityDescriptor;
import com.agentloop.core.capability.CapabilityInvocationPort;
import com.agentloop.core.context.ContextSettings;
import com.agentloop.core.context.SummarizationPort;
import com.agentloop.core.context.TruncatingSummarizer;
import com.agentloop.core.events.EventBus;
import com.agentloop.core.metrics.AgentLoopMetrics;
import com.agentloop.core.planning.PlanningPort;
import com.agentloop.core.planning.ReflectionPort;
import com.agentloop.core.validation.InputGuard;
import com.agentloop.core.validation.RuleBasedValidator;
import com.agentloop.core.validation.ValidationPort;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything one session needs, handed to its controller at construction. Nothing here is
 * looked up globally.
 *
 * @param reflector {@code null} when no reflection step is available
 * @param checkpointSaver {@code null} to run the loop graph without checkpoints
 */
public record SessionContext(
        String sessionId,
        LoopSettings settings,
        ContextSettings contextSettings,
        PlanningPort planner,
        CapabilityInvocationPort capabilities,
        List<CapabilityDescriptor> capabilityDescriptors,
        ValidationPort validator,
        ReflectionPort reflector,
        SummarizationPort summarizer,
        InputGuard inputGuard,
        BaseCheckpointSaver checkpointSaver,
        EventBus eventBus,
        AgentLoopMetrics metrics
) {

    public SessionContext {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(planner, "planner");
        Objects.requireNonNull(capabilities, "capabilities");
        capabilityDescriptors = capabilityDescriptors == null ? List.of() : List.copyOf(capabilityDescriptors);
    }

    public Optional<ReflectionPort> reflection() {
        return Optional.ofNullable(reflector);
    }

    public static Builder builder(String sessionId) {
        return new Builder(sessionId);
    }

    public static final class Builder {
        private final String sessionId;
        private LoopSettings settings = LoopSettings.defaults();
        private ContextSettings contextSettings = ContextSettings.defaults();
        private PlanningPort planner;
        private CapabilityInvocationPort capabilities;
        private List<CapabilityDescriptor> capabilityDescriptors = List.of();
        private ValidationPort validator;
        private ReflectionPort reflector;
        private SummarizationPort summarizer;
        private InputGuard inputGuard;
        private BaseCheckpointSaver checkpointSaver;
        private EventBus eventBus;
        private AgentLoopMetrics metrics;

        private Builder(String sessionId) {
            this.sessionId = sessionId;
        }

        public Builder settings(LoopSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder contextSettings(ContextSettings contextSettings) {
            this.contextSettings = contextSettings;
            return this;
        }

        public Builder planner(PlanningPort planner) {
            this.planner = planner;
            return this;
        }

        public Builder capabilities(CapabilityInvocationPort capabilities) {
            this.capabilities = capabilities;
            return this;
        }

        public Builder capabilityDescriptors(List<CapabilityDescriptor> capabilityDescriptors) {
            this.capabilityDescriptors = capabilityDescriptors;
            return this;
        }

        public Builder validator(ValidationPort validator) {
            this.validator = validator;
            return this;
        }

        public Builder reflector(ReflectionPort reflector) {
            this.reflector = reflector;
            return this;
        }

        public Builder summarizer(SummarizationPort summarizer) {
            this.summarizer = summarizer;
            return this;
        }

        public Builder inputGuard(InputGuard inputGuard) {
            this.inputGuard = inputGuard;
            return this;
        }

        public Builder checkpointSaver(BaseCheckpointSaver checkpointSaver) {
            this.checkpointSaver = checkpointSaver;
            return this;
        }

        public Builder eventBus(EventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public Builder metrics(AgentLoopMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /** Unset collaborators fall back to in-memory defaults; an unset saver means no checkpoints. */
        public SessionContext build() {
            return new SessionContext(sessionId, settings, contextSettings, planner, capabilities,
                    capabilityDescriptors,
                    validator != null ? validator : RuleBasedValidator.defaults(),
                    reflector,
                    summarizer != null ? summarizer : new TruncatingSummarizer(),
                    inputGuard != null ? inputGuard : new InputGuard(10_000),
                    checkpointSaver,
                    eventBus != null ? eventBus : new EventBus(),
                    metrics != null ? metrics : new AgentLoopMetrics(new SimpleMeterRegistry()));
        }
    }
}
