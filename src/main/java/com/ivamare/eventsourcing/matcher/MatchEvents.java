package com.ivamare.eventsourcing.matcher;

import com.ivamare.eventsourcing.model.Event;

import java.util.Arrays;
import java.util.Set;

/**
 * Matches events whose type is one of the given event types.
 *
 * @param eventTypes accepted event types
 */
public record MatchEvents(Set<String> eventTypes) implements EventMatcher {

    public MatchEvents {
        eventTypes = eventTypes == null ? Set.of() : Set.copyOf(eventTypes);
    }

    public static MatchEvents of(String... eventTypes) {
        return new MatchEvents(Set.copyOf(Arrays.asList(eventTypes)));
    }

    @Override
    public boolean matches(Event event) {
        return event != null && eventTypes.contains(event.eventType());
    }
}
