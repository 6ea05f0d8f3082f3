package com.agentloop.core.validation;

import com.agentloop.core.model.Termination;

/**
 * Where the loop goes after a validation pass.
 */
public record GateDecision(Route route, Termination termination, String reason) {

    public enum Route {
        DONE,
        CONTINUE,
        REPLAN,
        FAIL
    }

    static GateDecision done(String reason) {
        return new GateDecision(Route.DONE, Termination.COMPLETED, reason);
    }

    static GateDecision proceed(String reason) {
        return new GateDecision(Route.CONTINUE, Termination.NONE, reason);
    }

    static GateDecision replan(String reason) {
        return new GateDecision(Route.REPLAN, Termination.NONE, reason);
    }

    static GateDecision fail(Termination termination, String reason) {
        return new GateDecision(Route.FAIL, termination, reason);
    }
}
