package com.agentloop.core.capability;

/**
 * Result of one capability call: either an output or an error diagnostic.
 */
public record CapabilityResult(boolean success, String output, String error) {

    public static CapabilityResult ok(String output) {
        return new CapabilityResult(true, output, null);
    }

    public static CapabilityResult failure(String error) {
        return new CapabilityResult(false, null, error);
    }
}
