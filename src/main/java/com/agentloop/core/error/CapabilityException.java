package com.agentloop.core.error;

/**
 * A capability invocation failed. Recoverable up to the node retry limit.
 */
public class CapabilityException extends AgentLoopException {

    private final String capabilityRef;

    public CapabilityException(String capabilityRef, String message) {
        super(message);
        this.capabilityRef = capabilityRef;
    }

    public CapabilityException(String capabilityRef, String message, Throwable cause) {
        super(message, cause);
        this.capabilityRef = capabilityRef;
    }

    public String getCapabilityRef() {
        return capabilityRef;
    }
}
