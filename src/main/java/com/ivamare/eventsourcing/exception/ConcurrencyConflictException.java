package com.ivamare.eventsourcing.exception;

import com.ivamare.eventsourcing.model.Event;

import java.util.List;
import java.util.UUID;

/**
 * Thrown when a save was based on a stale aggregate version.
 *
 * <p>Recoverable: the caller reloads the aggregate and redoes its work.
 */
public class ConcurrencyConflictException extends EventStoreException {

    private final int actualVersion;

    public ConcurrencyConflictException(
            String aggregateType,
            UUID aggregateId,
            int expectedVersion,
            int actualVersion,
            List<Event> events) {
        this(aggregateType, aggregateId, expectedVersion, actualVersion, events, null);
    }

    public ConcurrencyConflictException(
            String aggregateType,
            UUID aggregateId,
            int expectedVersion,
            int actualVersion,
            List<Event> events,
            Throwable cause) {
        super(EventStoreOperation.SAVE,
            actualVersion < 0
                ? "concurrency conflict, version " + (expectedVersion + 1) + " already taken"
                : "concurrency conflict, expected version " + expectedVersion + " but was " + actualVersion,
            aggregateType, aggregateId, expectedVersion, events, cause);
        this.actualVersion = actualVersion;
    }

    public int getExpectedVersion() {
        return getAggregateVersion();
    }

    /**
     * The version found in the store, or -1 when a racing writer was detected
     * by a key violation and the current version is unknown.
     */
    public int getActualVersion() {
        return actualVersion;
    }
}
