package com.agentloop.core.error;

/**
 * The context store cannot keep its effective view within the token budget,
 * even after forced compression.
 */
public class BudgetExceededException extends AgentLoopException {

    private final int requiredTokens;
    private final int maxTokens;

    public BudgetExceededException(String message, int requiredTokens, int maxTokens) {
        super(message + " (required " + requiredTokens + " tokens, max " + maxTokens + ")");
        this.requiredTokens = requiredTokens;
        this.maxTokens = maxTokens;
    }

    public int getRequiredTokens() {
        return requiredTokens;
    }

    public int getMaxTokens() {
        return maxTokens;
    }
}
