package com.ivamare.eventsourcing.repository;

import com.ivamare.eventsourcing.aggregate.Aggregate;
import com.ivamare.eventsourcing.model.HandlerContext;

import java.util.Optional;
import java.util.UUID;

/**
 * Loads and saves whole aggregates, hiding replay and snapshots from callers.
 *
 * <p>Repositories may wrap one another. A wrapping layer forwards {@link #save}
 * unchanged and only answers {@link #load} itself when the result is provably
 * the same as the inner repository's.
 */
public interface Repository {

    /**
     * Load an aggregate at its latest committed version.
     *
     * @throws com.ivamare.eventsourcing.exception.AggregateNotFoundException if there is
     *         neither a snapshot nor any event
     */
    Aggregate load(HandlerContext context, String aggregateType, UUID aggregateId);

    /**
     * Save the aggregate's uncommitted events. A no-op without uncommitted events.
     *
     * @throws com.ivamare.eventsourcing.exception.ConcurrencyConflictException if the
     *         aggregate is stale; the aggregate is left untouched
     */
    void save(HandlerContext context, Aggregate aggregate);

    /**
     * @return the wrapped repository, empty for a base repository
     */
    default Optional<Repository> innerRepository() {
        return Optional.empty();
    }
}
