package com.agentloop.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer metrics for agent loop sessions.
 */
@Service
public class AgentLoopMetrics {

    private final MeterRegistry registry;

    public AgentLoopMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPlanningDuration(long ms, boolean replanning) {
        Timer.builder("agentloop.planning.duration")
                .tag("kind", replanning ? "replan" : "plan")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param outcome {@code succeeded}, {@code failed} or {@code timeout}
     */
    public void recordNodeExecution(String capability, String outcome, long ms) {
        Timer.builder("agentloop.node.duration")
                .tag("capability", capability)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordNodeRetry(String capability) {
        Counter.builder("agentloop.node.retries")
                .tag("capability", capability)
                .register(registry)
                .increment();
    }

    public void recordWave(int nodeCount, boolean parallel) {
        DistributionSummary.builder("agentloop.wave.size")
                .description("Number of nodes dispatched per wave")
                .tag("strategy", parallel ? "parallel" : "sequential")
                .register(registry)
                .record(nodeCount);
    }

    /**
     * @param level the level of detail the round moved to
     */
    public void recordCompression(String level) {
        Counter.builder("agentloop.context.compressions")
                .tag("level", level)
                .register(registry)
                .increment();
    }

    public void recordValidation(boolean passed) {
        Counter.builder("agentloop.validation.evaluations")
                .tag("result", passed ? "passed" : "failed")
                .register(registry)
                .increment();
    }

    public void recordReplan() {
        Counter.builder("agentloop.replans.total")
                .register(registry)
                .increment();
    }

    public void recordIterationDepth(int depth) {
        DistributionSummary.builder("agentloop.iteration.depth")
                .register(registry)
                .record(depth);
    }

    public void recordSessionResult(String termination) {
        Counter.builder("agentloop.sessions.total")
                .tag("termination", termination)
                .register(registry)
                .increment();
    }
}
