package com.agentloop.core.capability;

import java.time.Duration;
import java.util.Map;

/**
 * The only way the loop executes work. Capabilities are opaque and stateless across calls.
 */
public interface CapabilityInvocationPort {

    /**
     * Invokes a capability and blocks until it finishes. The caller enforces {@code timeout}
     * by interrupting the calling thread; implementations may also honour it themselves.
     *
     * @throws com.agentloop.core.error.CapabilityException when the call cannot be carried out
     */
    CapabilityResult invoke(String capabilityRef, Map<String, String> arguments, Duration timeout);
}
