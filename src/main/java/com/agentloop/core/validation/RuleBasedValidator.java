package com.agentloop.core.validation;

import com.agentloop.core.context.EffectiveView;
import com.agentloop.core.model.NodeResult;
import com.agentloop.core.model.Severity;
import com.agentloop.core.model.ValidationResult;
import com.agentloop.core.model.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a fixed list of rules in order.
 * <p>
 * Passes when no rule reports an {@link Severity#ERROR}. The score starts at 1.0 and loses
 * 0.2 per error and 0.1 per warning, floored at zero.
 */
public class RuleBasedValidator implements ValidationPort {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedValidator.class);

    private final List<ValidationRule> rules;

    public RuleBasedValidator(List<ValidationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static RuleBasedValidator defaults() {
        return fromNames(List.of(FailedNodeRule.NAME, EmptyOutputRule.NAME, SensitiveDataRule.NAME), 10);
    }

    /**
     * @throws IllegalArgumentException on an unknown rule name
     */
    public static RuleBasedValidator fromNames(List<String> names, int minOutputChars) {
        var rules = new ArrayList<ValidationRule>();
        for (String name : names) {
            rules.add(switch (name) {
                case FailedNodeRule.NAME -> new FailedNodeRule();
                case EmptyOutputRule.NAME -> new EmptyOutputRule(minOutputChars);
                case SensitiveDataRule.NAME -> new SensitiveDataRule();
                default -> throw new IllegalArgumentException("Unknown validation rule: " + name);
            });
        }
        return new RuleBasedValidator(rules);
    }

    public List<String> ruleNames() {
        return rules.stream().map(ValidationRule::name).toList();
    }

    @Override
    public ValidationResult validate(EffectiveView view, List<NodeResult> latestResults) {
        var violations = new ArrayList<Violation>();
        for (ValidationRule rule : rules) {
            violations.addAll(rule.evaluate(view, latestResults));
        }
        long errors = violations.stream().filter(v -> v.severity() == Severity.ERROR).count();
        long warnings = violations.stream().filter(v -> v.severity() == Severity.WARNING).count();
        double score = Math.max(0.0, 1.0 - 0.2 * errors - 0.1 * warnings);
        boolean passed = errors == 0;
        log.info("Validation {}: {} error(s), {} warning(s), score {}",
                passed ? "passed" : "failed", errors, warnings, String.format("%.2f", score));
        return new ValidationResult(passed, violations, score);
    }
}
