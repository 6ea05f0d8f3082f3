package com.agentloop.core.capability;

import java.util.Map;

/**
 * Concrete implementation behind a registered capability.
 */
@FunctionalInterface
public interface CapabilityHandler {

    /**
     * @param arguments arguments from the task node
     * @return the capability's output
     * @throws Exception any failure; the registry reports it as a capability error
     */
    String handle(Map<String, String> arguments) throws Exception;
}
