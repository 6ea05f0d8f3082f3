package com.agentloop.core.llm;

import com.agentloop.core.error.AgentLoopException;

/**
 * Model output could not be mapped onto the requested type, even leniently.
 */
public class LlmParseException extends AgentLoopException {

    private final String rawResponse;

    public LlmParseException(String message, String rawResponse, Throwable cause) {
        super(message, cause);
        this.rawResponse = rawResponse;
    }

    public String getRawResponse() {
        return rawResponse;
    }
}
