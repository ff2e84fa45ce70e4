package com.ivamare.eventsourcing.eventstore.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventsourcing.eventstore.EventBatchValidator;
import com.ivamare.eventsourcing.eventstore.EventStore;
import com.ivamare.eventsourcing.eventstore.EventStoreMaintenance;
import com.ivamare.eventsourcing.exception.AggregateNotFoundException;
import com.ivamare.eventsourcing.exception.ConcurrencyConflictException;
import com.ivamare.eventsourcing.exception.EventStoreException;
import com.ivamare.eventsourcing.exception.EventStoreOperation;
import com.ivamare.eventsourcing.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * PostgreSQL event store on the {@code eventsourcing.event} table.
 *
 * <p>The primary key {@code (aggregate_id, version)} makes two writers of the same
 * version impossible. A save reads the current version, compares it and inserts
 * the batch in one transaction; a racing writer surfaces either as a version
 * mismatch or as a duplicate key, both reported as a concurrency conflict.
 */
public class JdbcEventStore implements EventStore, EventStoreMaintenance {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private static final String SELECT_COLUMNS = """
        SELECT aggregate_id, version, aggregate_type, event_type, timestamp, data, metadata
        FROM eventsourcing.event
        """;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;

    public JdbcEventStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                          ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(List<Event> events, int expectedVersion) {
        EventBatchValidator.validate(events, expectedVersion);

        Event first = events.get(0);
        UUID aggregateId = first.aggregateId();
        List<Object[]> batchArgs = new ArrayList<>(events.size());
        for (Event event : events) {
            batchArgs.add(new Object[] {
                event.aggregateId(),
                event.version(),
                event.aggregateType(),
                event.eventType(),
                Timestamp.from(event.timestamp()),
                event.data(),
                toJson(event.metadata(), EventStoreOperation.SAVE, event)
            });
        }

        try {
            transactionTemplate.execute(status -> {
                Integer current = jdbcTemplate.queryForObject(
                    "SELECT COALESCE(MAX(version), 0) FROM eventsourcing.event WHERE aggregate_id = ?",
                    Integer.class,
                    aggregateId
                );
                int currentVersion = current != null ? current : 0;
                if (currentVersion != expectedVersion) {
                    throw new ConcurrencyConflictException(
                        first.aggregateType(), aggregateId, expectedVersion, currentVersion, events);
                }

                jdbcTemplate.batchUpdate("""
                    INSERT INTO eventsourcing.event (
                        aggregate_id, version, aggregate_type, event_type, timestamp, data, metadata
                    ) VALUES (?, ?, ?, ?, ?, ?, ?::jsonb)
                    """, batchArgs);
                return null;
            });
        } catch (DuplicateKeyException e) {
            throw new ConcurrencyConflictException(
                first.aggregateType(), aggregateId, expectedVersion, -1, events, e);
        } catch (DataAccessException e) {
            throw new EventStoreException(EventStoreOperation.SAVE, "could not save events",
                first.aggregateType(), aggregateId, expectedVersion, events, e);
        }

        log.debug("Saved {} events for {} {} (v{} -> v{})",
            events.size(), first.aggregateType(), aggregateId,
            expectedVersion, expectedVersion + events.size());
    }

    @Override
    public List<Event> load(UUID aggregateId) {
        List<Event> events = query(EventStoreOperation.LOAD, aggregateId, 0,
            SELECT_COLUMNS + " WHERE aggregate_id = ? ORDER BY version", aggregateId);
        if (events.isEmpty()) {
            throw new AggregateNotFoundException(EventStoreOperation.LOAD, null, aggregateId, 0);
        }
        return events;
    }

    @Override
    public List<Event> loadFrom(UUID aggregateId, int version) {
        List<Event> events = query(EventStoreOperation.LOAD_FROM, aggregateId, version,
            SELECT_COLUMNS + " WHERE aggregate_id = ? AND version >= ? ORDER BY version", aggregateId, version);
        if (events.isEmpty()) {
            throw new AggregateNotFoundException(EventStoreOperation.LOAD_FROM, null, aggregateId, version);
        }
        return events;
    }

    @Override
    public void replace(Event event) {
        int updated;
        try {
            updated = jdbcTemplate.update("""
                UPDATE eventsourcing.event
                SET event_type = ?, aggregate_type = ?, timestamp = ?, data = ?, metadata = ?::jsonb
                WHERE aggregate_id = ? AND version = ?
                """,
                event.eventType(),
                event.aggregateType(),
                Timestamp.from(event.timestamp()),
                event.data(),
                toJson(event.metadata(), EventStoreOperation.REPLACE, event),
                event.aggregateId(),
                event.version()
            );
        } catch (DataAccessException e) {
            throw new EventStoreException(EventStoreOperation.REPLACE, "could not replace event",
                event.aggregateType(), event.aggregateId(), event.version(), List.of(event), e);
        }
        if (updated == 0) {
            throw new AggregateNotFoundException(EventStoreOperation.REPLACE,
                event.aggregateType(), event.aggregateId(), event.version());
        }
        log.info("Replaced event {} v{} of {} {}",
            event.eventType(), event.version(), event.aggregateType(), event.aggregateId());
    }

    @Override
    public int renameEvent(String fromEventType, String toEventType) {
        int renamed;
        try {
            renamed = jdbcTemplate.update(
                "UPDATE eventsourcing.event SET event_type = ? WHERE event_type = ?",
                toEventType, fromEventType
            );
        } catch (DataAccessException e) {
            throw new EventStoreException(EventStoreOperation.RENAME,
                "could not rename " + fromEventType + " to " + toEventType, null, null, 0, List.of(), e);
        }
        log.info("Renamed {} events from {} to {}", renamed, fromEventType, toEventType);
        return renamed;
    }

    @Override
    public void close() {
        // Connections belong to the DataSource
        log.debug("JDBC event store closed");
    }

    private List<Event> query(EventStoreOperation operation, UUID aggregateId, int version,
                              String sql, Object... args) {
        try {
            return jdbcTemplate.query(sql, this::mapEvent, args);
        } catch (DataAccessException e) {
            throw new EventStoreException(operation, "could not load events",
                null, aggregateId, version, List.of(), e);
        }
    }

    private Event mapEvent(ResultSet rs, int rowNum) throws SQLException {
        String metadataJson = rs.getString("metadata");
        Map<String, Object> metadata = Map.of();
        if (metadataJson != null) {
            try {
                metadata = objectMapper.readValue(metadataJson, METADATA_TYPE);
            } catch (JsonProcessingException e) {
                throw new SQLException("Invalid event metadata: " + e.getOriginalMessage(), e);
            }
        }
        return new Event(
            rs.getString("event_type"),
            rs.getString("aggregate_type"),
            rs.getObject("aggregate_id", UUID.class),
            rs.getInt("version"),
            rs.getTimestamp("timestamp").toInstant(),
            rs.getBytes("data"),
            metadata
        );
    }

    private String toJson(Map<String, Object> metadata, EventStoreOperation operation, Event event) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new EventStoreException(operation, "could not serialize metadata",
                event.aggregateType(), event.aggregateId(), event.version(), List.of(event), e);
        }
    }
}
