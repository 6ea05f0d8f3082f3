package com.agentloop.core.llm;

import com.agentloop.core.error.AgentLoopException;

/**
 * The model answered with null or blank content.
 */
public class LlmEmptyResponseException extends AgentLoopException {

    private final String expected;

    public LlmEmptyResponseException(String expected) {
        super("Model returned empty content for " + expected);
        this.expected = expected;
    }

    public String getExpected() {
        return expected;
    }
}
