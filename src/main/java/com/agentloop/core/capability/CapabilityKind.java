package com.agentloop.core.capability;

/**
 * How a registered capability is carried out. Dispatch on the kind stays inside the registry.
 */
public enum CapabilityKind {
    FUNCTION,
    SUBAGENT,
    PROTOCOL_TOOL
}
