package com.ivamare.eventsourcing.snapshot.impl;

import com.ivamare.eventsourcing.exception.SnapshotStoreException;
import com.ivamare.eventsourcing.model.Snapshot;
import com.ivamare.eventsourcing.snapshot.SnapshotStore;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL snapshot store on the {@code eventsourcing.snapshot} table, one row per aggregate.
 */
public class JdbcSnapshotStore implements SnapshotStore {

    private static final RowMapper<Snapshot> SNAPSHOT_ROW_MAPPER = (rs, rowNum) -> new Snapshot(
        rs.getObject("aggregate_id", UUID.class),
        rs.getString("aggregate_type"),
        rs.getInt("version"),
        rs.getTimestamp("timestamp").toInstant(),
        rs.getBytes("state")
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcSnapshotStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Snapshot> loadSnapshot(UUID aggregateId) {
        try {
            List<Snapshot> results = jdbcTemplate.query("""
                SELECT aggregate_id, aggregate_type, version, timestamp, state
                FROM eventsourcing.snapshot
                WHERE aggregate_id = ?
                """, SNAPSHOT_ROW_MAPPER, aggregateId);
            return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
        } catch (DataAccessException e) {
            throw new SnapshotStoreException("could not load snapshot", aggregateId, e);
        }
    }

    @Override
    public void saveSnapshot(UUID aggregateId, Snapshot snapshot) {
        try {
            jdbcTemplate.update("""
                INSERT INTO eventsourcing.snapshot (aggregate_id, aggregate_type, version, timestamp, state)
                VALUES (?, ?, ?, ?, ?)
                ON CONFLICT (aggregate_id) DO UPDATE
                SET aggregate_type = EXCLUDED.aggregate_type,
                    version = EXCLUDED.version,
                    timestamp = EXCLUDED.timestamp,
                    state = EXCLUDED.state
                """,
                aggregateId,
                snapshot.aggregateType(),
                snapshot.version(),
                Timestamp.from(snapshot.timestamp()),
                snapshot.state()
            );
        } catch (DataAccessException e) {
            throw new SnapshotStoreException("could not save snapshot", aggregateId, e);
        }
    }
}
