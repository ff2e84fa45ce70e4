package com.ivamare.eventsourcing.eventstore;

import com.ivamare.eventsourcing.model.Event;

import java.util.List;
import java.util.UUID;

/**
 * Append-only, per-aggregate, version-ordered event log with optimistic concurrency.
 *
 * <p>The check of the last stored version against the expected version and the
 * append are one atomic step per aggregate: of two savers with the same expected
 * version at most one succeeds. Reads of one aggregate never wait for writes to
 * another.
 */
public interface EventStore extends AutoCloseable {

    /**
     * Append events to one aggregate's stream.
     *
     * @param events non-empty, same aggregate, versions {@code expectedVersion+1, +2, ...}
     * @param expectedVersion the last version the caller has seen, 0 for a new aggregate
     * @throws com.ivamare.eventsourcing.exception.ConcurrencyConflictException if the
     *         stored version differs from {@code expectedVersion}; nothing is written
     * @throws com.ivamare.eventsourcing.exception.InvalidInputException if the batch is
     *         empty, mixes aggregates or has non-contiguous versions
     */
    void save(List<Event> events, int expectedVersion);

    /**
     * Load the full history of an aggregate, oldest first.
     *
     * @throws com.ivamare.eventsourcing.exception.AggregateNotFoundException if no events exist
     */
    List<Event> load(UUID aggregateId);

    /**
     * Load the events with version greater than or equal to {@code version}, oldest first.
     *
     * @throws com.ivamare.eventsourcing.exception.AggregateNotFoundException if the aggregate
     *         does not exist or has no events at or after the version
     */
    List<Event> loadFrom(UUID aggregateId, int version);

    /**
     * Release underlying resources.
     */
    @Override
    void close();
}
