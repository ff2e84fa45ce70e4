package com.ivamare.eventsourcing.snapshot.impl;

import com.ivamare.eventsourcing.model.Snapshot;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySnapshotStoreTest {

    private final InMemorySnapshotStore store = new InMemorySnapshotStore();

    @Test
    void shouldReturnEmptyWithoutSnapshot() {
        assertTrue(store.loadSnapshot(UUID.randomUUID()).isEmpty());
    }

    @Test
    void shouldKeepLatestSnapshotOnly() {
        UUID id = UUID.randomUUID();
        store.saveSnapshot(id, new Snapshot(id, "Counter", 3, Instant.now(), new byte[] {3}));
        store.saveSnapshot(id, new Snapshot(id, "Counter", 6, Instant.now(), new byte[] {6}));

        Snapshot loaded = store.loadSnapshot(id).orElseThrow();

        assertEquals(6, loaded.version());
        assertArrayEquals(new byte[] {6}, loaded.state());
    }

    @Test
    void shouldRejectMissingSnapshot() {
        assertThrows(IllegalArgumentException.class, () -> store.saveSnapshot(UUID.randomUUID(), null));
    }
}
