package com.agentloop.config;

import com.agentloop.core.context.ContextSettings;
import com.agentloop.core.engine.LoopSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class LoopPropertiesTest {

    @Test
    @DisplayName("defaults match the built-in settings")
    void defaults() {
        var properties = new LoopProperties();

        assertEquals(LoopSettings.defaults(), properties.toLoopSettings());
        assertEquals(ContextSettings.defaults(), properties.toContextSettings());
        assertFalse(properties.getCheckpoint().isFileStore());
    }

    @Test
    @DisplayName("bound values flow into the settings records")
    void overrides() {
        var properties = new LoopProperties();
        properties.getSession().setMaxIterations(5);
        properties.getSession().setParallelExecution(false);
        properties.getSession().setNodeTimeout(Duration.ofSeconds(7));
        properties.getContext().setMaxTokens(1000);
        properties.getContext().setSummaryBudgetTokens(50);
        properties.getCheckpoint().setStore("FILE");

        LoopSettings loop = properties.toLoopSettings();
        ContextSettings context = properties.toContextSettings();

        assertEquals(5, loop.maxIterations());
        assertEquals(1, loop.parallelism());
        assertEquals(Duration.ofSeconds(7), loop.nodeTimeout());
        assertEquals(1000, context.maxTokens());
        assertEquals(50, context.summaryBudgetTokens());
        assertTrue(properties.getCheckpoint().isFileStore());
    }

    @Test
    @DisplayName("invalid values are rejected when the settings are built")
    void invalid() {
        var properties = new LoopProperties();
        properties.getSession().setRetryLimit(0);
        properties.getContext().setCompressionThresholdFraction(1.5);

        assertThrows(IllegalArgumentException.class, properties::toLoopSettings);
        assertThrows(IllegalArgumentException.class, properties::toContextSettings);
    }
}
