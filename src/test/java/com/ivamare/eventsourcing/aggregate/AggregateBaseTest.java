package com.ivamare.eventsourcing.aggregate;

import com.ivamare.eventsourcing.fixtures.CounterAggregate;
import com.ivamare.eventsourcing.fixtures.TestEvents;
import com.ivamare.eventsourcing.model.Event;
import com.ivamare.eventsourcing.model.HandlerContext;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AggregateBaseTest {

    private final UUID id = UUID.randomUUID();

    @Test
    void newAggregateShouldStartAtVersionZero() {
        CounterAggregate counter = new CounterAggregate(id);

        assertEquals(0, counter.aggregateVersion());
        assertEquals(id, counter.entityId());
        assertEquals("Counter", counter.aggregateType());
        assertTrue(counter.uncommittedEvents().isEmpty());
    }

    @Test
    void appendedEventsShouldBeNumberedAfterPendingOnes() {
        CounterAggregate counter = new CounterAggregate(id);
        counter.setAggregateVersion(4);

        counter.handleCommand(HandlerContext.empty(), TestEvents.command("Increment", id));
        counter.handleCommand(HandlerContext.empty(), TestEvents.command("Increment", id));

        List<Event> pending = counter.uncommittedEvents();
        assertEquals(5, pending.get(0).version());
        assertEquals(6, pending.get(1).version());
        assertEquals(4, counter.aggregateVersion());
    }

    @Test
    void appendedEventsShouldBeAppliedImmediately() {
        CounterAggregate counter = new CounterAggregate(id);

        counter.handleCommand(HandlerContext.empty(), TestEvents.rename(id, "first"));

        assertEquals("first", counter.getName());
        assertEquals(1, counter.getAppliedEvents());
    }

    @Test
    void uncommittedEventsShouldBeReadOnlyCopy() {
        CounterAggregate counter = new CounterAggregate(id);
        counter.handleCommand(HandlerContext.empty(), TestEvents.command("Increment", id));

        List<Event> pending = counter.uncommittedEvents();
        counter.clearUncommittedEvents();

        assertEquals(1, pending.size());
        assertTrue(counter.uncommittedEvents().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> pending.add(pending.get(0)));
    }

    @Test
    void shouldRequireTypeAndId() {
        assertThrows(IllegalArgumentException.class, () -> new CounterAggregate(null));
    }
}
