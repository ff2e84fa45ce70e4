package com.ivamare.eventsourcing.matcher;

import com.ivamare.eventsourcing.model.Event;

import java.util.List;

/**
 * Logical OR over sub-matchers. Stops at the first match; an empty list matches nothing.
 *
 * @param matchers the alternatives
 */
public record MatchAny(List<EventMatcher> matchers) implements EventMatcher {

    public MatchAny {
        matchers = matchers == null ? List.of() : List.copyOf(matchers);
    }

    public static MatchAny of(EventMatcher... matchers) {
        return new MatchAny(List.of(matchers));
    }

    @Override
    public boolean matches(Event event) {
        for (EventMatcher matcher : matchers) {
            if (matcher.matches(event)) {
                return true;
            }
        }
        return false;
    }
}
