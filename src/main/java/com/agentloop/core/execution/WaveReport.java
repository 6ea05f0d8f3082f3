package com.agentloop.core.execution;

import java.util.List;

/**
 * Everything one wave produced.
 *
 * @param outcomes outcomes of dispatched nodes, in dispatch order
 * @param undispatched ids of ready nodes never started because the session deadline passed
 * @param sessionExpired whether the session deadline passed during the wave
 */
public record WaveReport(List<NodeOutcome> outcomes, List<String> undispatched, boolean sessionExpired) {

    public WaveReport {
        outcomes = List.copyOf(outcomes);
        undispatched = List.copyOf(undispatched);
    }

    public long failures() {
        return outcomes.stream().filter(o -> !o.succeeded()).count();
    }
}
