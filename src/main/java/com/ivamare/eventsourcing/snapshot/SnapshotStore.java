package com.ivamare.eventsourcing.snapshot;

import com.ivamare.eventsourcing.model.Snapshot;

import java.util.Optional;
import java.util.UUID;

/**
 * Keyed cache of the latest snapshot per aggregate.
 *
 * <p>A pure optimization: loading an aggregate gives the same result with or
 * without a snapshot.
 */
public interface SnapshotStore {

    /**
     * @return the latest snapshot, empty if none was taken
     */
    Optional<Snapshot> loadSnapshot(UUID aggregateId);

    /**
     * Store a snapshot, replacing any earlier one for the aggregate.
     */
    void saveSnapshot(UUID aggregateId, Snapshot snapshot);
}
