package com.agentloop.core.events;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * An event emitted while a session runs.
 *
 * @param type      what happened
 * @param sessionId session the event belongs to
 * @param taskId    task node concerned, {@code null} for session-level events
 * @param payload   event details
 * @param timestamp when the event was produced
 */
public record LoopEvent(
        LoopEventType type,
        String sessionId,
        String taskId,
        Map<String, Object> payload,
        Instant timestamp
) {

    public LoopEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(sessionId, "sessionId");
        if (type.taskScoped() && taskId == null) {
            throw new IllegalArgumentException(type.key() + " needs a task id");
        }
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static LoopEvent session(LoopEventType type, String sessionId, Map<String, Object> payload) {
        return new LoopEvent(type, sessionId, null, payload, Instant.now());
    }

    public static LoopEvent task(LoopEventType type, String sessionId, String taskId, Map<String, Object> payload) {
        return new LoopEvent(type, sessionId, taskId, payload, Instant.now());
    }

    /** Dotted name of {@link #type()}. */
    public String eventType() {
        return type.key();
    }
}
