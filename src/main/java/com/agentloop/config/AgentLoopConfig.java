package com.agentloop.config;

import com.agentloop.core.capability.CapabilityRegistry;
import com.agentloop.core.context.ContextSettings;
import com.agentloop.core.context.SummarizationPort;
import com.agentloop.core.engine.LoopSettings;
import com.agentloop.core.llm.LlmPlanner;
import com.agentloop.core.llm.LlmReflector;
import com.agentloop.core.llm.LlmService;
import com.agentloop.core.llm.LlmSummarizer;
import com.agentloop.core.planning.PlanningPort;
import com.agentloop.core.planning.ReflectionPort;
import com.agentloop.core.validation.InputGuard;
import com.agentloop.core.validation.RuleBasedValidator;
import com.agentloop.core.validation.ValidationPort;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the loop's ports and settings. Every port bean backs off when the host application
 * declares its own.
 */
@Configuration
@EnableConfigurationProperties(LoopProperties.class)
public class AgentLoopConfig {

    private static final Logger log = LoggerFactory.getLogger(AgentLoopConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public LoopSettings loopSettings(LoopProperties properties) {
        LoopSettings settings = properties.toLoopSettings();
        log.info("Loop settings: {}", settings);
        return settings;
    }

    @Bean
    public ContextSettings contextSettings(LoopProperties properties) {
        return properties.toContextSettings();
    }

    /** Empty registry; the host application registers its capabilities on startup. */
    @Bean
    @ConditionalOnMissingBean
    public CapabilityRegistry capabilityRegistry() {
        return new CapabilityRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public ValidationPort validationPort(LoopProperties properties) {
        var validation = properties.getValidation();
        var validator = RuleBasedValidator.fromNames(validation.getRules(), validation.getMinOutputChars());
        log.info("Validation rules: {}", validator.ruleNames());
        return validator;
    }

    @Bean
    public InputGuard inputGuard(LoopProperties properties) {
        return new InputGuard(properties.getValidation().getMaxGoalChars());
    }

    @Bean
    @ConditionalOnMissingBean
    public PlanningPort planningPort(LlmService llmService) {
        return new LlmPlanner(llmService);
    }

    @Bean
    @ConditionalOnMissingBean
    public SummarizationPort summarizationPort(LlmService llmService) {
        return new LlmSummarizer(llmService);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReflectionPort reflectionPort(LlmService llmService) {
        return new LlmReflector(llmService);
    }
}
