package com.ivamare.eventsourcing.matcher;

import com.ivamare.eventsourcing.model.Event;

import java.util.List;

/**
 * Logical AND over sub-matchers. Stops at the first mismatch; an empty list matches everything.
 *
 * @param matchers the conditions
 */
public record MatchAll(List<EventMatcher> matchers) implements EventMatcher {

    static final MatchAll ALL = new MatchAll(List.of());

    public MatchAll {
        matchers = matchers == null ? List.of() : List.copyOf(matchers);
    }

    public static MatchAll of(EventMatcher... matchers) {
        return new MatchAll(List.of(matchers));
    }

    @Override
    public boolean matches(Event event) {
        for (EventMatcher matcher : matchers) {
            if (!matcher.matches(event)) {
                return false;
            }
        }
        return true;
    }
}
