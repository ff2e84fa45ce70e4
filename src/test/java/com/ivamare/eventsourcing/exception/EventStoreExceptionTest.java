package com.ivamare.eventsourcing.exception;

import com.ivamare.eventsourcing.fixtures.TestEvents;
import com.ivamare.eventsourcing.model.Event;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class EventStoreExceptionTest {

    private static final UUID ID = UUID.fromString("11111111-2222-3333-4444-555555555555");

    @Test
    void shouldFormatOperationReasonAndAggregate() {
        EventStoreException ex = new EventStoreException(
            EventStoreOperation.LOAD, "connection lost", "Order", ID, 3, null);

        assertEquals("event store: load: connection lost, Order(" + ID + ", v3)", ex.getMessage());
        assertEquals(EventStoreOperation.LOAD, ex.getOperation());
        assertEquals("connection lost", ex.getReason());
        assertTrue(ex.getEvents().isEmpty());
    }

    @Test
    void shouldUseGenericNameWithoutAggregateType() {
        EventStoreException ex = new EventStoreException(
            EventStoreOperation.LOAD_FROM, "boom", null, ID, 0, List.of());

        assertEquals("event store: load from: boom, Aggregate(" + ID + ", v0)", ex.getMessage());
    }

    @Test
    void conflictShouldCarryExpectedAndActualVersions() {
        List<Event> events = TestEvents.increments(ID, 3, 3);

        ConcurrencyConflictException ex = new ConcurrencyConflictException("Counter", ID, 2, 4, events);

        assertEquals(EventStoreOperation.SAVE, ex.getOperation());
        assertEquals(2, ex.getExpectedVersion());
        assertEquals(4, ex.getActualVersion());
        assertEquals(events, ex.getEvents());
        assertEquals("event store: save: concurrency conflict, expected version 2 but was 4, Counter("
            + ID + ", v2)", ex.getMessage());
    }

    @Test
    void conflictFromKeyViolationShouldNameTakenVersion() {
        ConcurrencyConflictException ex = new ConcurrencyConflictException("Counter", ID, 2, -1, List.of());

        assertTrue(ex.getMessage().contains("version 3 already taken"));
    }

    @Test
    void notFoundShouldBeEventStoreException() {
        EventStoreException ex = new AggregateNotFoundException(EventStoreOperation.LOAD, "Counter", ID, 0);

        assertEquals("aggregate not found", ex.getReason());
        assertInstanceOf(EventSourcingException.class, ex);
    }
}
