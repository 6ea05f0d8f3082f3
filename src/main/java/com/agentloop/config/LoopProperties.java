package com.agentloop.config;

import com.agentloop.core.context.ContextSettings;
import com.agentloop.core.engine.LoopSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "agentloop")
public class LoopProperties {

    private Session session = new Session();
    private Context context = new Context();
    private Validation validation = new Validation();
    private Checkpoint checkpoint = new Checkpoint();

    public Session getSession() {
        return session;
    }

    public void setSession(Session session) {
        this.session = session;
    }

    public Context getContext() {
        return context;
    }

    public void setContext(Context context) {
        this.context = context;
    }

    public Validation getValidation() {
        return validation;
    }

    public void setValidation(Validation validation) {
        this.validation = validation;
    }

    public Checkpoint getCheckpoint() {
        return checkpoint;
    }

    public void setCheckpoint(Checkpoint checkpoint) {
        this.checkpoint = checkpoint;
    }

    public LoopSettings toLoopSettings() {
        return LoopSettings.builder()
                .maxIterations(session.maxIterations)
                .maxReplans(session.maxReplans)
                .enableReplanning(session.enableReplanning)
                .enableReflection(session.enableReflection)
                .parallelExecution(session.parallelExecution)
                .maxParallel(session.maxParallel)
                .retryLimit(session.retryLimit)
                .nodeTimeout(session.nodeTimeout)
                .sessionTimeout(session.sessionTimeout)
                .build();
    }

    public ContextSettings toContextSettings() {
        return new ContextSettings(context.maxTokens, context.compressionThresholdFraction,
                context.archiveAfterRounds, context.summaryBudgetTokens);
    }

    public static class Session {

        private int maxIterations = 20;
        private int maxReplans = 3;
        private boolean enableReplanning = true;
        private boolean enableReflection = false;
        private boolean parallelExecution = true;
        private int maxParallel = 4;
        private int retryLimit = 3;
        private Duration nodeTimeout = Duration.ofSeconds(120);
        private Duration sessionTimeout = Duration.ofMinutes(30);

        public int getMaxIterations() {
            return maxIterations;
        }

        public void setMaxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
        }

        public int getMaxReplans() {
            return maxReplans;
        }

        public void setMaxReplans(int maxReplans) {
            this.maxReplans = maxReplans;
        }

        public boolean isEnableReplanning() {
            return enableReplanning;
        }

        public void setEnableReplanning(boolean enableReplanning) {
            this.enableReplanning = enableReplanning;
        }

        public boolean isEnableReflection() {
            return enableReflection;
        }

        public void setEnableReflection(boolean enableReflection) {
            this.enableReflection = enableReflection;
        }

        public boolean isParallelExecution() {
            return parallelExecution;
        }

        public void setParallelExecution(boolean parallelExecution) {
            this.parallelExecution = parallelExecution;
        }

        public int getMaxParallel() {
            return maxParallel;
        }

        public void setMaxParallel(int maxParallel) {
            this.maxParallel = maxParallel;
        }

        public int getRetryLimit() {
            return retryLimit;
        }

        public void setRetryLimit(int retryLimit) {
            this.retryLimit = retryLimit;
        }

        public Duration getNodeTimeout() {
            return nodeTimeout;
        }

        public void setNodeTimeout(Duration nodeTimeout) {
            this.nodeTimeout = nodeTimeout;
        }

        public Duration getSessionTimeout() {
            return sessionTimeout;
        }

        public void setSessionTimeout(Duration sessionTimeout) {
            this.sessionTimeout = sessionTimeout;
        }
    }

    public static class Context {

        private int maxTokens = 8000;
        private double compressionThresholdFraction = 0.8;
        private int archiveAfterRounds = 4;
        private int summaryBudgetTokens = 400;

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public double getCompressionThresholdFraction() {
            return compressionThresholdFraction;
        }

        public void setCompressionThresholdFraction(double compressionThresholdFraction) {
            this.compressionThresholdFraction = compressionThresholdFraction;
        }

        public int getArchiveAfterRounds() {
            return archiveAfterRounds;
        }

        public void setArchiveAfterRounds(int archiveAfterRounds) {
            this.archiveAfterRounds = archiveAfterRounds;
        }

        public int getSummaryBudgetTokens() {
            return summaryBudgetTokens;
        }

        public void setSummaryBudgetTokens(int summaryBudgetTokens) {
            this.summaryBudgetTokens = summaryBudgetTokens;
        }
    }

    public static class Validation {

        private List<String> rules = new ArrayList<>(List.of("failed-nodes", "empty-output", "sensitive-data"));
        private int minOutputChars = 10;
        private int maxGoalChars = 10_000;

        public List<String> getRules() {
            return rules;
        }

        public void setRules(List<String> rules) {
            this.rules = rules;
        }

        public int getMinOutputChars() {
            return minOutputChars;
        }

        public void setMinOutputChars(int minOutputChars) {
            this.minOutputChars = minOutputChars;
        }

        public int getMaxGoalChars() {
            return maxGoalChars;
        }

        public void setMaxGoalChars(int maxGoalChars) {
            this.maxGoalChars = maxGoalChars;
        }
    }

    /** Where session snapshots go when no DataSource is configured. */
    public static class Checkpoint {

        private String store = "memory";
        private String directory = ".agentloop/checkpoints";

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public boolean isFileStore() {
            return "file".equalsIgnoreCase(store);
        }
    }
}
