package com.agentloop.core.engine;

import java.time.Duration;

/**
 * Session configuration consumed by the loop controller.
 *
 * @param maxIterations cap on execution waves
 * @param maxReplans cap on replanning passes
 * @param retryLimit attempts a node gets before it fails permanently
 * @param maxParallel concurrent capability calls per wave when parallel execution is on
 */
public record LoopSettings(
        int maxIterations,
        int maxReplans,
        boolean enableReplanning,
        boolean enableReflection,
        boolean parallelExecution,
        int maxParallel,
        int retryLimit,
        Duration nodeTimeout,
        Duration sessionTimeout
) {

    public LoopSettings {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        if (maxReplans < 0) {
            throw new IllegalArgumentException("maxReplans must not be negative, got " + maxReplans);
        }
        if (maxParallel < 1) {
            throw new IllegalArgumentException("maxParallel must be at least 1, got " + maxParallel);
        }
        if (retryLimit < 1) {
            throw new IllegalArgumentException("retryLimit must be at least 1, got " + retryLimit);
        }
        if (nodeTimeout == null || nodeTimeout.isZero() || nodeTimeout.isNegative()) {
            throw new IllegalArgumentException("nodeTimeout must be positive");
        }
        if (sessionTimeout == null || sessionTimeout.isZero() || sessionTimeout.isNegative()) {
            throw new IllegalArgumentException("sessionTimeout must be positive");
        }
    }

    public static LoopSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Effective number of concurrent calls in one wave. */
    public int parallelism() {
        return parallelExecution ? maxParallel : 1;
    }

    public Builder toBuilder() {
        return new Builder()
                .maxIterations(maxIterations)
                .maxReplans(maxReplans)
                .enableReplanning(enableReplanning)
                .enableReflection(enableReflection)
                .parallelExecution(parallelExecution)
                .maxParallel(maxParallel)
                .retryLimit(retryLimit)
                .nodeTimeout(nodeTimeout)
                .sessionTimeout(sessionTimeout);
    }

    public static final class Builder {
        private int maxIterations = 20;
        private int maxReplans = 3;
        private boolean enableReplanning = true;
        private boolean enableReflection = false;
        private boolean parallelExecution = true;
        private int maxParallel = 4;
        private int retryLimit = 3;
        private Duration nodeTimeout = Duration.ofMinutes(2);
        private Duration sessionTimeout = Duration.ofMinutes(30);

        private Builder() {}

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder maxReplans(int maxReplans) {
            this.maxReplans = maxReplans;
            return this;
        }

        public Builder enableReplanning(boolean enableReplanning) {
            this.enableReplanning = enableReplanning;
            return this;
        }

        public Builder enableReflection(boolean enableReflection) {
            this.enableReflection = enableReflection;
            return this;
        }

        public Builder parallelExecution(boolean parallelExecution) {
            this.parallelExecution = parallelExecution;
            return this;
        }

        public Builder maxParallel(int maxParallel) {
            this.maxParallel = maxParallel;
            return this;
        }

        public Builder retryLimit(int retryLimit) {
            this.retryLimit = retryLimit;
            return this;
        }

        public Builder nodeTimeout(Duration nodeTimeout) {
            this.nodeTimeout = nodeTimeout;
            return this;
        }

        public Builder sessionTimeout(Duration sessionTimeout) {
            this.sessionTimeout = sessionTimeout;
            return this;
        }

        public LoopSettings build() {
            return new LoopSettings(maxIterations, maxReplans, enableReplanning, enableReflection,
                    parallelExecution, maxParallel, retryLimit, nodeTimeout, sessionTimeout);
        }
    }
}
