package com.agentloop.core.context;

/**
 * Size policy of a context store.
 *
 * @param maxTokens hard ceiling on the effective view
 * @param compressionThresholdFraction fraction of {@code maxTokens} above which raw rounds get compressed
 * @param archiveAfterRounds age, in rounds, after which a compressed round is archived
 * @param summaryBudgetTokens size budget handed to the summarizer for one round or digest
 */
public record ContextSettings(
        int maxTokens,
        double compressionThresholdFraction,
        int archiveAfterRounds,
        int summaryBudgetTokens
) {

    public ContextSettings {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive, got " + maxTokens);
        }
        if (compressionThresholdFraction <= 0.0 || compressionThresholdFraction > 1.0) {
            throw new IllegalArgumentException("compressionThresholdFraction must be in (0, 1], got "
                    + compressionThresholdFraction);
        }
        if (archiveAfterRounds < 1) {
            throw new IllegalArgumentException("archiveAfterRounds must be at least 1, got " + archiveAfterRounds);
        }
        if (summaryBudgetTokens <= 0 || summaryBudgetTokens > maxTokens) {
            throw new IllegalArgumentException("summaryBudgetTokens must be in (0, maxTokens], got "
                    + summaryBudgetTokens);
        }
    }

    public static ContextSettings defaults() {
        return new ContextSettings(8000, 0.8, 4, 400);
    }

    /** Total above which {@code maybeCompress} starts compressing raw rounds. */
    public double thresholdTokens() {
        return compressionThresholdFraction * maxTokens;
    }
}
