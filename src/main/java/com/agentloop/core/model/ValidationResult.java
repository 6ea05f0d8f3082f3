package com.agentloop.core.model;

import java.util.List;

/**
 * Outcome of one validation pass.
 *
 * @param passed whether the loop may treat the current outputs as acceptable
 * @param violations findings in rule evaluation order
 * @param score optional quality score in [0, 1]
 */
public record ValidationResult(boolean passed, List<Violation> violations, Double score) {

    public ValidationResult {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public static ValidationResult pass() {
        return new ValidationResult(true, List.of(), 1.0);
    }

    public static ValidationResult fail(String ruleName, String message) {
        return new ValidationResult(false, List.of(new Violation(ruleName, Severity.ERROR, message)), 0.0);
    }

    public long countOf(Severity severity) {
        return violations.stream().filter(v -> v.severity() == severity).count();
    }
}
