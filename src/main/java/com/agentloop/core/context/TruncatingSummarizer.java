package com.agentloop.core.context;

/**
 * Deterministic summarizer that keeps the head of the content and marks the cut.
 */
public class TruncatingSummarizer implements SummarizationPort {

    static final String ELISION = " [...]";

    @Override
    public String summarize(String rawContent, int sizeBudgetTokens) {
        if (rawContent == null) {
            return "";
        }
        String text = rawContent.strip();
        int maxChars = TokenEstimator.maxChars(sizeBudgetTokens);
        if (text.length() <= maxChars) {
            return text;
        }
        if (maxChars <= ELISION.length()) {
            return text.substring(0, maxChars);
        }
        return text.substring(0, maxChars - ELISION.length()) + ELISION;
    }
}
