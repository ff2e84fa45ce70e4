package com.ivamare.eventsourcing.model;

import com.ivamare.eventsourcing.exception.EventMismatchException;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Field-by-field event comparison for tests and migration checks.
 */
public final class EventComparison {

    static final String POSITION_KEY = "position";

    private EventComparison() {
    }

    /**
     * Compare two events.
     *
     * @throws EventMismatchException naming the first field that differs
     */
    public static void compare(Event actual, Event expected, CompareOption... options) {
        Set<CompareOption> opts = options.length == 0 ? Set.of() : Set.of(options);

        if (actual == null || expected == null) {
            if (actual != expected) {
                throw new EventMismatchException("Event", actual, expected);
            }
            return;
        }
        if (!actual.eventType().equals(expected.eventType())) {
            throw new EventMismatchException("Event type", actual.eventType(), expected.eventType());
        }
        if (!Arrays.equals(actual.data(), expected.data())) {
            throw new EventMismatchException("Event data", actual.data().length + " bytes",
                expected.data().length + " bytes");
        }
        if (!opts.contains(CompareOption.IGNORE_TIMESTAMP) && !actual.timestamp().equals(expected.timestamp())) {
            throw new EventMismatchException("Event timestamp", actual.timestamp(), expected.timestamp());
        }
        if (!actual.aggregateType().equals(expected.aggregateType())) {
            throw new EventMismatchException("Aggregate type", actual.aggregateType(), expected.aggregateType());
        }
        if (!actual.aggregateId().equals(expected.aggregateId())) {
            throw new EventMismatchException("Aggregate ID", actual.aggregateId(), expected.aggregateId());
        }
        if (!opts.contains(CompareOption.IGNORE_VERSION) && actual.version() != expected.version()) {
            throw new EventMismatchException("Event version", actual.version(), expected.version());
        }

        Map<String, Object> actualMetadata = actual.metadata();
        Map<String, Object> expectedMetadata = expected.metadata();
        if (opts.contains(CompareOption.IGNORE_POSITION_METADATA)) {
            actualMetadata = withoutPosition(actualMetadata);
            expectedMetadata = withoutPosition(expectedMetadata);
        }
        if (!actualMetadata.equals(expectedMetadata)) {
            throw new EventMismatchException("Event metadata", actualMetadata, expectedMetadata);
        }
    }

    /**
     * @return true if both lists have the same events in the same order
     */
    public static boolean sameEvents(List<Event> actual, List<Event> expected, CompareOption... options) {
        if (actual.size() != expected.size()) {
            return false;
        }
        for (int i = 0; i < actual.size(); i++) {
            try {
                compare(actual.get(i), expected.get(i), options);
            } catch (EventMismatchException e) {
                return false;
            }
        }
        return true;
    }

    private static Map<String, Object> withoutPosition(Map<String, Object> metadata) {
        if (!metadata.containsKey(POSITION_KEY)) {
            return metadata;
        }
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        copy.remove(POSITION_KEY);
        return copy;
    }
}
