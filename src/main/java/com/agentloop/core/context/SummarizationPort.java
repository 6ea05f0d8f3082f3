package com.agentloop.core.context;

/**
 * Produces a bounded-size summary of raw round content.
 * <p>
 * Implementations must return text whose {@link TokenEstimator} size does not exceed
 * {@code sizeBudgetTokens}, and must be deterministic for a fixed input.
 */
@FunctionalInterface
public interface SummarizationPort {

    String summarize(String rawContent, int sizeBudgetTokens);
}
