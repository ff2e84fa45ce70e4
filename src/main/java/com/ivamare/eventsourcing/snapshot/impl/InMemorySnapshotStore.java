package com.ivamare.eventsourcing.snapshot.impl;

import com.ivamare.eventsourcing.model.Snapshot;
import com.ivamare.eventsourcing.snapshot.SnapshotStore;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Snapshot store backed by a concurrent map.
 */
public class InMemorySnapshotStore implements SnapshotStore {

    private final Map<UUID, Snapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public Optional<Snapshot> loadSnapshot(UUID aggregateId) {
        return Optional.ofNullable(snapshots.get(aggregateId));
    }

    @Override
    public void saveSnapshot(UUID aggregateId, Snapshot snapshot) {
        if (aggregateId == null || snapshot == null) {
            throw new IllegalArgumentException("aggregateId and snapshot are required");
        }
        snapshots.put(aggregateId, snapshot);
    }
}
