package com.agentloop.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory fan-out of {@link LoopEvent}s.
 * <p>
 * A subscription filters on session (or none, for every session) and on a set of
 * {@link LoopEventType}s. Delivery happens on the publishing thread, in subscription order.
 * A subscriber that throws is logged and skipped; publishing never fails.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private record Subscriber(String sessionId, Set<LoopEventType> types, Consumer<LoopEvent> consumer) {

        boolean accepts(LoopEvent event) {
            return (sessionId == null || sessionId.equals(event.sessionId())) && types.contains(event.type());
        }
    }

    private final CopyOnWriteArrayList<Subscriber> subscribers = new CopyOnWriteArrayList<>();

    public void publish(LoopEvent event) {
        log.debug("Publishing {} for session {}{}", event.eventType(), event.sessionId(),
                event.taskId() == null ? "" : " task " + event.taskId());
        for (Subscriber subscriber : subscribers) {
            if (subscriber.accepts(event)) {
                deliverSafely(subscriber.consumer(), event);
            }
        }
    }

    /** Every event of one session. */
    public Subscription subscribe(String sessionId, Consumer<LoopEvent> consumer) {
        return add(new Subscriber(sessionId, EnumSet.allOf(LoopEventType.class), consumer));
    }

    /** Events of the given types from one session. */
    public Subscription subscribe(String sessionId, Set<LoopEventType> types, Consumer<LoopEvent> consumer) {
        return add(new Subscriber(sessionId, EnumSet.copyOf(types), consumer));
    }

    /** Events of the given types from every session. */
    public Subscription subscribe(Set<LoopEventType> types, Consumer<LoopEvent> consumer) {
        return add(new Subscriber(null, EnumSet.copyOf(types), consumer));
    }

    /** Every event from every session. */
    public Subscription subscribeAll(Consumer<LoopEvent> consumer) {
        return add(new Subscriber(null, EnumSet.allOf(LoopEventType.class), consumer));
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private Subscription add(Subscriber subscriber) {
        subscribers.add(subscriber);
        log.debug("Subscribed to {} for {}", subscriber.types(),
                subscriber.sessionId() == null ? "all sessions" : subscriber.sessionId());
        return () -> subscribers.remove(subscriber);
    }

    private void deliverSafely(Consumer<LoopEvent> consumer, LoopEvent event) {
        try {
            consumer.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber failed on {} for session {}: {}",
                    event.eventType(), event.sessionId(), e.getMessage(), e);
        }
    }
}
