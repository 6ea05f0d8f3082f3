package com.agentloop.core.validation;

import com.agentloop.core.context.EffectiveView;
import com.agentloop.core.model.NodeResult;
import com.agentloop.core.model.Severity;
import com.agentloop.core.model.Violation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Rejects outputs that look like they leak credentials.
 */
public class SensitiveDataRule implements ValidationRule {

    public static final String NAME = "sensitive-data";

    private static final Map<String, Pattern> PATTERNS = Map.of(
            "api key", Pattern.compile("\\b[A-Za-z0-9]{32,}\\b"),
            "password", Pattern.compile("(?i)password[\"\\s:=]+[^\\s\"]+"),
            "token", Pattern.compile("(?i)token[\"\\s:=]+[^\\s\"]+"));

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Violation> evaluate(EffectiveView view, List<NodeResult> results) {
        var violations = new ArrayList<Violation>();
        for (NodeResult r : results) {
            if (r.output() == null) {
                continue;
            }
            PATTERNS.entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .filter(e -> e.getValue().matcher(r.output()).find())
                    .forEach(e -> violations.add(new Violation(NAME, Severity.ERROR,
                            "Node " + r.nodeId() + " output may contain a " + e.getKey())));
        }
        return violations;
    }
}
