package com.ivamare.eventsourcing.snapshot.impl;

import com.ivamare.eventsourcing.exception.SnapshotStoreException;
import com.ivamare.eventsourcing.model.Snapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JdbcSnapshotStoreTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private JdbcSnapshotStore store;
    private UUID id;

    @BeforeEach
    void setUp() {
        store = new JdbcSnapshotStore(jdbcTemplate);
        id = UUID.randomUUID();
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldReturnEmptyWhenNoRow() {
        when(jdbcTemplate.query(contains("FROM eventsourcing.snapshot"), any(RowMapper.class), eq(id)))
            .thenReturn(List.of());

        assertEquals(Optional.empty(), store.loadSnapshot(id));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldReturnStoredSnapshot() {
        Snapshot snapshot = new Snapshot(id, "Counter", 4, Instant.now(), new byte[] {4});
        when(jdbcTemplate.query(contains("FROM eventsourcing.snapshot"), any(RowMapper.class), eq(id)))
            .thenReturn(List.of(snapshot));

        assertEquals(snapshot, store.loadSnapshot(id).orElseThrow());
    }

    @Test
    void shouldUpsertSnapshot() {
        Instant ts = Instant.parse("2024-01-01T00:00:00Z");

        store.saveSnapshot(id, new Snapshot(id, "Counter", 4, ts, new byte[] {4}));

        verify(jdbcTemplate).update(
            contains("ON CONFLICT (aggregate_id) DO UPDATE"),
            eq(id),
            eq("Counter"),
            eq(4),
            eq(Timestamp.from(ts)),
            any(byte[].class)
        );
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldWrapDatabaseErrors() {
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), eq(id)))
            .thenThrow(new DataAccessResourceFailureException("down"));

        SnapshotStoreException ex = assertThrows(SnapshotStoreException.class, () -> store.loadSnapshot(id));
        assertEquals(id, ex.getAggregateId());
    }
}
