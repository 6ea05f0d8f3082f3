package com.agentloop.core.llm;

import com.agentloop.core.context.SummarizationPort;
import com.agentloop.core.context.TokenEstimator;
import com.agentloop.core.context.TruncatingSummarizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Model-backed summarizer. Falls back to {@link TruncatingSummarizer} when the call fails
 * or the answer does not fit the budget, so the store always gets a bounded summary.
 */
public class LlmSummarizer implements SummarizationPort {

    private static final Logger log = LoggerFactory.getLogger(LlmSummarizer.class);

    static final String SYSTEM_PROMPT = """
            You compress the working history of an agent loop. Merge the content into a
            dense summary that keeps: decisions taken, task ids with their outcomes, errors,
            and any facts later steps depend on. Drop repetition and formatting.
            Answer with the summary text only.
            """;

    private final LlmService llmService;
    private final TruncatingSummarizer fallback = new TruncatingSummarizer();

    public LlmSummarizer(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public String summarize(String rawContent, int sizeBudgetTokens) {
        String userPrompt = "Keep the summary under " + TokenEstimator.maxChars(sizeBudgetTokens)
                + " characters.\n\nCONTENT:\n" + rawContent;
        try {
            String summary = llmService.textCall(SYSTEM_PROMPT, userPrompt);
            if (TokenEstimator.estimate(summary) <= sizeBudgetTokens) {
                return summary;
            }
            log.warn("Summary of {} tokens exceeds budget {}; truncating instead",
                    TokenEstimator.estimate(summary), sizeBudgetTokens);
        } catch (RuntimeException e) {
            log.warn("Summarization call failed, truncating instead: {}", e.getMessage());
        }
        return fallback.summarize(rawContent, sizeBudgetTokens);
    }
}
