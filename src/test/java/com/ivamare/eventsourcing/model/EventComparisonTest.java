package com.ivamare.eventsourcing.model;

import com.ivamare.eventsourcing.exception.EventMismatchException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class EventComparisonTest {

    private final UUID id = UUID.randomUUID();
    private final Instant ts = Instant.parse("2024-01-01T00:00:00Z");

    private Event event(String type, int version, Instant timestamp, Map<String, Object> metadata) {
        return new Event(type, "Order", id, version, timestamp, new byte[] {1}, metadata);
    }

    @Test
    void shouldAcceptEqualEvents() {
        assertDoesNotThrow(() -> EventComparison.compare(
            event("Created", 1, ts, Map.of()), event("Created", 1, ts, Map.of())));
    }

    @Test
    void shouldNameMismatchingEventType() {
        EventMismatchException ex = assertThrows(EventMismatchException.class, () -> EventComparison.compare(
            event("Created", 1, ts, Map.of()), event("Renamed", 1, ts, Map.of())));

        assertEquals("Event type mismatch: Created (should be Renamed)", ex.getMessage());
        assertEquals("Event type", ex.getField());
    }

    @Test
    void shouldIgnoreTimestampAndVersionWhenAsked() {
        Event actual = event("Created", 1, ts, Map.of());
        Event expected = event("Created", 2, ts.plusSeconds(5), Map.of());

        assertThrows(EventMismatchException.class, () -> EventComparison.compare(actual, expected));
        assertDoesNotThrow(() -> EventComparison.compare(actual, expected,
            CompareOption.IGNORE_TIMESTAMP, CompareOption.IGNORE_VERSION));
    }

    @Test
    void shouldIgnorePositionMetadataWhenAsked() {
        Event actual = event("Created", 1, ts, Map.of("position", 42, "user", "a"));
        Event expected = event("Created", 1, ts, Map.of("user", "a"));

        assertThrows(EventMismatchException.class, () -> EventComparison.compare(actual, expected));
        assertDoesNotThrow(() -> EventComparison.compare(actual, expected, CompareOption.IGNORE_POSITION_METADATA));
    }

    @Test
    void shouldCompareLists() {
        List<Event> a = List.of(event("Created", 1, ts, Map.of()), event("Renamed", 2, ts, Map.of()));
        List<Event> b = List.of(event("Created", 1, ts, Map.of()), event("Renamed", 2, ts, Map.of()));

        assertTrue(EventComparison.sameEvents(a, b));
        assertFalse(EventComparison.sameEvents(a, b.subList(0, 1)));
        assertFalse(EventComparison.sameEvents(a, List.of(b.get(1), b.get(0))));
    }
}
