package com.ivamare.eventsourcing.aggregate;

import com.ivamare.eventsourcing.model.Snapshot;

/**
 * Aggregate that can export and restore its state, allowing replay to start
 * from a snapshot instead of version 1.
 */
public interface Snapshotable {

    /**
     * Capture the current committed state.
     */
    Snapshot createSnapshot();

    /**
     * Restore state from a snapshot. The repository sets the version afterwards.
     *
     * @throws RuntimeException if the state cannot be restored, which makes the
     *         repository fall back to a full replay
     */
    void applySnapshot(Snapshot snapshot);
}
