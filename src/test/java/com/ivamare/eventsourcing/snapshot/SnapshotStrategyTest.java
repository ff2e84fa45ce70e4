package com.ivamare.eventsourcing.snapshot;

import com.ivamare.eventsourcing.fixtures.CounterAggregate;
import com.ivamare.eventsourcing.fixtures.TestEvents;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotStrategyTest {

    private final UUID id = UUID.randomUUID();

    private boolean decide(SnapshotStrategy strategy, int fromVersion, int toVersion) {
        CounterAggregate counter = new CounterAggregate(id);
        counter.setAggregateVersion(toVersion);
        return strategy.shouldTakeSnapshot(counter, TestEvents.increments(id, fromVersion, toVersion));
    }

    @Test
    void shouldFireWhenSaveReachesMultiple() {
        SnapshotStrategy strategy = SnapshotStrategy.everyNumberOfEvents(3);

        assertFalse(decide(strategy, 1, 2));
        assertTrue(decide(strategy, 3, 3));
        assertFalse(decide(strategy, 4, 5));
        assertTrue(decide(strategy, 6, 6));
    }

    @Test
    void shouldFireWhenBatchCrossesMultiple() {
        SnapshotStrategy strategy = SnapshotStrategy.everyNumberOfEvents(3);

        assertTrue(decide(strategy, 2, 4));
        assertFalse(decide(strategy, 4, 5));
    }

    @Test
    void nonPositiveIntervalShouldNeverFire() {
        assertFalse(decide(SnapshotStrategy.everyNumberOfEvents(0), 1, 10));
        assertFalse(decide(SnapshotStrategy.everyNumberOfEvents(-1), 1, 10));
        assertFalse(decide(SnapshotStrategy.never(), 1, 10));
    }
}
