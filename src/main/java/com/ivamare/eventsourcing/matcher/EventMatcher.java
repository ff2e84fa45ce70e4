package com.ivamare.eventsourcing.matcher;

import com.ivamare.eventsourcing.model.Event;

import java.util.List;

/**
 * Predicate selecting the events a handler is interested in.
 *
 * <p>Implementations must be pure: they are evaluated repeatedly and
 * concurrently by the event bus and the outbox.
 */
@FunctionalInterface
public interface EventMatcher {

    /**
     * @param event the event to test, may be null
     * @return true if the handler should receive the event
     */
    boolean matches(Event event);

    default EventMatcher and(EventMatcher other) {
        return new MatchAll(List.of(this, other));
    }

    default EventMatcher or(EventMatcher other) {
        return new MatchAny(List.of(this, other));
    }

    /**
     * Matcher accepting every event.
     */
    static EventMatcher any() {
        return MatchAll.ALL;
    }
}
