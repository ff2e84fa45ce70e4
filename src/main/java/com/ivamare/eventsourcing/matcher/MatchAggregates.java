package com.ivamare.eventsourcing.matcher;

import com.ivamare.eventsourcing.model.Event;

import java.util.Arrays;
import java.util.Set;

/**
 * Matches events that belong to one of the given aggregate types.
 *
 * @param aggregateTypes accepted aggregate types
 */
public record MatchAggregates(Set<String> aggregateTypes) implements EventMatcher {

    public MatchAggregates {
        aggregateTypes = aggregateTypes == null ? Set.of() : Set.copyOf(aggregateTypes);
    }

    public static MatchAggregates of(String... aggregateTypes) {
        return new MatchAggregates(Set.copyOf(Arrays.asList(aggregateTypes)));
    }

    @Override
    public boolean matches(Event event) {
        return event != null && aggregateTypes.contains(event.aggregateType());
    }
}
