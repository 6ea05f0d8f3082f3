package com.agentloop.core.engine;

import com.agentloop.core.model.LoopPhase;
import com.agentloop.core.persistence.LoopCheckpoints;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Graph state flowing between the loop's phase nodes.
 * <p>
 * Scalars mirror the controller's {@link LoopState} after each node; {@code snapshot} holds the
 * whole {@link LoopState} as JSON so a checkpoint saver can persist and restore it. The
 * {@code trail} appender records every node the graph ran, in order.
 */
public class LoopGraphState extends AgentState {

    public static final String SESSION_ID = "sessionId";
    public static final String GOAL = "goal";
    public static final String PHASE = "phase";
    public static final String ITERATION = "iteration";
    public static final String REPLANS = "replans";
    public static final String ROUTE = "route";
    public static final String TRAIL = "trail";

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
            Map.entry(SESSION_ID, Channels.base(() -> "")),
            Map.entry(GOAL, Channels.base(() -> "")),
            Map.entry(PHASE, Channels.base(() -> LoopPhase.PLANNING.name())),
            Map.entry(ITERATION, Channels.base(() -> 0)),
            Map.entry(REPLANS, Channels.base(() -> 0)),
            Map.entry(ROUTE, Channels.base(() -> "")),
            Map.entry(LoopCheckpoints.SNAPSHOT_KEY, Channels.base(() -> "")),
            Map.entry(TRAIL, Channels.appender(ArrayList::new))
    );

    public LoopGraphState(Map<String, Object> initData) {
        super(initData);
    }

    public String sessionId() {
        return this.<String>value(SESSION_ID).orElse("");
    }

    public String goal() {
        return this.<String>value(GOAL).orElse("");
    }

    public LoopPhase phase() {
        return LoopPhase.valueOf(this.<String>value(PHASE).orElse(LoopPhase.PLANNING.name()));
    }

    public int iteration() {
        return this.<Number>value(ITERATION).map(Number::intValue).orElse(0);
    }

    public int replans() {
        return this.<Number>value(REPLANS).map(Number::intValue).orElse(0);
    }

    /** Gate route chosen by the latest validation node, empty before the first one. */
    public String route() {
        return this.<String>value(ROUTE).orElse("");
    }

    public String snapshot() {
        return this.<String>value(LoopCheckpoints.SNAPSHOT_KEY).orElse("");
    }

    public List<String> trail() {
        return this.<List<String>>value(TRAIL).orElse(List.of());
    }
}
