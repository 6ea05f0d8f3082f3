package com.agentloop.core.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class LlmSummarizerTest {

    private final LlmService llmService = mock(LlmService.class);
    private final LlmSummarizer summarizer = new LlmSummarizer(llmService);

    @Test
    @DisplayName("a summary within budget is used as is")
    void withinBudget() {
        when(llmService.textCall(eq(LlmSummarizer.SYSTEM_PROMPT), anyString())).thenReturn("fetched page, 3 facts");

        assertEquals("fetched page, 3 facts", summarizer.summarize("x".repeat(400), 10));
        verify(llmService).textCall(eq(LlmSummarizer.SYSTEM_PROMPT), contains("Keep the summary under 40 characters."));
    }

    @Test
    @DisplayName("an over-budget summary falls back to truncation")
    void overBudget() {
        when(llmService.textCall(anyString(), anyString())).thenReturn("y".repeat(200));

        String summary = summarizer.summarize("z".repeat(400), 10);

        assertEquals("z".repeat(34) + " [...]", summary);
    }

    @Test
    @DisplayName("a failing call falls back to truncation")
    void failingCall() {
        when(llmService.textCall(anyString(), anyString())).thenThrow(new LlmEmptyResponseException("text"));

        assertEquals("short content", summarizer.summarize("short content", 10));
    }
}
