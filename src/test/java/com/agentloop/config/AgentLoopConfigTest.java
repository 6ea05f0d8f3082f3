package com.agentloop.config;

import com.agentloop.core.error.AgentLoopException;
import com.agentloop.core.llm.LlmPlanner;
import com.agentloop.core.llm.LlmReflector;
import com.agentloop.core.llm.LlmService;
import com.agentloop.core.llm.LlmSummarizer;
import com.agentloop.core.validation.RuleBasedValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class AgentLoopConfigTest {

    private final AgentLoopConfig config = new AgentLoopConfig();

    @Test
    @DisplayName("validator is built from the configured rule names")
    void validatorFromProperties() {
        var properties = new LoopProperties();
        properties.getValidation().setRules(List.of("failed-nodes"));

        var validator = (RuleBasedValidator) config.validationPort(properties);

        assertEquals(List.of("failed-nodes"), validator.ruleNames());
    }

    @Test
    @DisplayName("an unknown rule name fails configuration")
    void unknownRule() {
        var properties = new LoopProperties();
        properties.getValidation().setRules(List.of("failed-nodes", "spelling"));

        assertThrows(IllegalArgumentException.class, () -> config.validationPort(properties));
    }

    @Test
    @DisplayName("input guard uses the configured goal limit")
    void inputGuard() {
        var properties = new LoopProperties();
        properties.getValidation().setMaxGoalChars(5);

        var guard = config.inputGuard(properties);

        assertThrows(AgentLoopException.class, () -> guard.check("too long a goal"));
    }

    @Test
    @DisplayName("model-backed ports are the defaults")
    void modelBackedPorts() {
        var llmService = mock(LlmService.class);

        assertInstanceOf(LlmPlanner.class, config.planningPort(llmService));
        assertInstanceOf(LlmSummarizer.class, config.summarizationPort(llmService));
        assertInstanceOf(LlmReflector.class, config.reflectionPort(llmService));
        assertTrue(config.capabilityRegistry().descriptors().isEmpty());
    }
}
