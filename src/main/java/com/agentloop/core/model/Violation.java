package com.agentloop.core.model;

/**
 * A single rule finding produced during validation.
 */
public record Violation(String ruleName, Severity severity, String message) {
}
