package com.agentloop.core.validation;

import com.agentloop.core.error.PlanningException;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Screens the goal text before anything is planned from it.
 */
public class InputGuard {

    private static final List<Pattern> INJECTION_PATTERNS = List.of(
            Pattern.compile("(?i)\\bDROP\\s+TABLE\\b"),
            Pattern.compile("(?i)\\bDELETE\\s+FROM\\b"),
            Pattern.compile("(?i)\\bINSERT\\s+INTO\\b"),
            Pattern.compile("(?i)\\bEXEC\\s*\\("),
            Pattern.compile("(?i)<script"),
            Pattern.compile("(?i)javascript:"),
            Pattern.compile("(?i)\\bon(error|load)\\s*="));

    private final int maxChars;

    public InputGuard(int maxChars) {
        this.maxChars = maxChars;
    }

    /**
     * @throws PlanningException if the goal is blank, too long or carries an injection marker
     */
    public void check(String goal) {
        if (goal == null || goal.isBlank()) {
            throw new PlanningException("Goal must not be blank");
        }
        if (goal.length() > maxChars) {
            throw new PlanningException("Goal is " + goal.length() + " characters, limit is " + maxChars);
        }
        for (Pattern pattern : INJECTION_PATTERNS) {
            if (pattern.matcher(goal).find()) {
                throw new PlanningException("Goal rejected: matches disallowed pattern " + pattern.pattern());
            }
        }
    }
}
