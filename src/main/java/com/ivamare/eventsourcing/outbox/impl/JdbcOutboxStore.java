package com.ivamare.eventsourcing.outbox.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventsourcing.exception.EventSourcingException;
import com.ivamare.eventsourcing.model.Event;
import com.ivamare.eventsourcing.model.OutboxRecord;
import com.ivamare.eventsourcing.outbox.OutboxStore;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * PostgreSQL outbox store on the {@code eventsourcing.outbox} table.
 *
 * <p>Appends use the caller's transaction, so when the repository saves inside a
 * transaction the outbox rows commit or roll back with the event rows. Context
 * values must be serializable to JSON.
 */
public class JdbcOutboxStore implements OutboxStore {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcOutboxStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void append(Map<String, Object> context, List<Event> events) {
        if (events.isEmpty()) {
            return;
        }

        String contextJson = toJson(context);
        List<Object[]> batchArgs = new ArrayList<>(events.size());
        for (Event event : events) {
            batchArgs.add(new Object[] {
                event.aggregateId(),
                event.version(),
                event.aggregateType(),
                event.eventType(),
                Timestamp.from(event.timestamp()),
                event.data(),
                toJson(event.metadata()),
                contextJson,
                Timestamp.from(Instant.EPOCH)
            });
        }

        jdbcTemplate.batchUpdate("""
            INSERT INTO eventsourcing.outbox (
                aggregate_id, version, aggregate_type, event_type, timestamp, data, metadata,
                context, attempts, next_attempt_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, 0, ?)
            """, batchArgs);
    }

    @Override
    public List<OutboxRecord> pendingDue(Instant now, int limit) {
        Timestamp ts = Timestamp.from(now);
        return jdbcTemplate.query("""
            SELECT o.id, o.aggregate_id, o.version, o.aggregate_type, o.event_type, o.timestamp,
                   o.data, o.metadata, o.context, o.attempts, o.next_attempt_at, o.last_error
            FROM eventsourcing.outbox o
            WHERE o.next_attempt_at <= ?
              AND NOT EXISTS (
                  SELECT 1 FROM eventsourcing.outbox p
                  WHERE p.aggregate_id = o.aggregate_id
                    AND p.id < o.id
                    AND p.next_attempt_at > ?
              )
            ORDER BY o.id
            LIMIT ?
            """, this::mapRecord, ts, ts, limit);
    }

    @Override
    public void markDelivered(long id) {
        jdbcTemplate.update("DELETE FROM eventsourcing.outbox WHERE id = ?", id);
    }

    @Override
    public void markFailed(long id, int attempts, Instant nextAttemptAt, String error) {
        jdbcTemplate.update("""
            UPDATE eventsourcing.outbox
            SET attempts = ?, next_attempt_at = ?, last_error = ?
            WHERE id = ?
            """, attempts, Timestamp.from(nextAttemptAt), error, id);
    }

    @Override
    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM eventsourcing.outbox", Long.class);
        return count != null ? count : 0L;
    }

    private OutboxRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
        Event event = new Event(
            rs.getString("event_type"),
            rs.getString("aggregate_type"),
            rs.getObject("aggregate_id", UUID.class),
            rs.getInt("version"),
            rs.getTimestamp("timestamp").toInstant(),
            rs.getBytes("data"),
            fromJson(rs.getString("metadata"))
        );
        return new OutboxRecord(
            rs.getLong("id"),
            event,
            fromJson(rs.getString("context")),
            rs.getInt("attempts"),
            rs.getTimestamp("next_attempt_at").toInstant(),
            rs.getString("last_error")
        );
    }

    private String toJson(Map<String, Object> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new EventSourcingException("Failed to serialize outbox record: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> fromJson(String json) throws SQLException {
        if (json == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new SQLException("Invalid outbox JSON: " + e.getOriginalMessage(), e);
        }
    }
}
