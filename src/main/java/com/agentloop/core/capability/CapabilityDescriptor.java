package com.agentloop.core.capability;

/**
 * What the planner is told about a capability.
 */
public record CapabilityDescriptor(String name, CapabilityKind kind, String description) {
}
