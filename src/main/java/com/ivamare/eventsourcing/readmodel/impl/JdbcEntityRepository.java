package com.ivamare.eventsourcing.readmodel.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventsourcing.aggregate.Entity;
import com.ivamare.eventsourcing.exception.EntityRepositoryException;
import com.ivamare.eventsourcing.exception.EntityRepositoryOperation;
import com.ivamare.eventsourcing.readmodel.ReadWriteRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL read-model repository on the {@code eventsourcing.read_model} table.
 *
 * <p>Entities are stored as JSON, one row per (entity type, id). Several
 * repositories share the table, each scoped to its own entity type.
 *
 * @param <T> entity type
 */
public class JdbcEntityRepository<T extends Entity> implements ReadWriteRepository<T> {

    private static final Logger log = LoggerFactory.getLogger(JdbcEntityRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final String entityType;
    private final Class<T> entityClass;
    private final Clock clock;

    public JdbcEntityRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper,
                                String entityType, Class<T> entityClass) {
        this(jdbcTemplate, objectMapper, entityType, entityClass, Clock.systemUTC());
    }

    public JdbcEntityRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper,
                                String entityType, Class<T> entityClass, Clock clock) {
        if (entityType == null || entityType.isBlank()) {
            throw new IllegalArgumentException("entityType is required");
        }
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.entityType = entityType;
        this.entityClass = entityClass;
        this.clock = clock;
    }

    @Override
    public Optional<T> find(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        try {
            List<T> results = jdbcTemplate.query("""
                SELECT data
                FROM eventsourcing.read_model
                WHERE entity_type = ? AND entity_id = ?
                """, this::mapEntity, entityType, id);
            return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
        } catch (DataAccessException e) {
            throw new EntityRepositoryException(EntityRepositoryOperation.FIND, "could not load entity", id, e);
        }
    }

    @Override
    public List<T> findAll() {
        try {
            return jdbcTemplate.query("""
                SELECT data
                FROM eventsourcing.read_model
                WHERE entity_type = ?
                ORDER BY entity_id
                """, this::mapEntity, entityType);
        } catch (DataAccessException e) {
            throw new EntityRepositoryException(EntityRepositoryOperation.FIND_ALL, "could not load entities",
                null, e);
        }
    }

    @Override
    public void save(T entity) {
        UUID id = entity == null ? null : entity.entityId();
        if (id == null) {
            throw new EntityRepositoryException(EntityRepositoryOperation.SAVE, "missing entity id", null, null);
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(entity);
        } catch (JsonProcessingException e) {
            throw new EntityRepositoryException(EntityRepositoryOperation.SAVE,
                "could not serialize entity: " + e.getOriginalMessage(), id, e);
        }
        try {
            jdbcTemplate.update("""
                INSERT INTO eventsourcing.read_model (entity_type, entity_id, data, updated_at)
                VALUES (?, ?, ?::jsonb, ?)
                ON CONFLICT (entity_type, entity_id) DO UPDATE
                SET data = EXCLUDED.data,
                    updated_at = EXCLUDED.updated_at
                """,
                entityType,
                id,
                json,
                Timestamp.from(clock.instant())
            );
        } catch (DataAccessException e) {
            throw new EntityRepositoryException(EntityRepositoryOperation.SAVE, "could not save entity", id, e);
        }
    }

    @Override
    public boolean remove(UUID id) {
        if (id == null) {
            return false;
        }
        try {
            int rowsAffected = jdbcTemplate.update(
                "DELETE FROM eventsourcing.read_model WHERE entity_type = ? AND entity_id = ?",
                entityType, id);
            return rowsAffected > 0;
        } catch (DataAccessException e) {
            throw new EntityRepositoryException(EntityRepositoryOperation.REMOVE, "could not remove entity", id, e);
        }
    }

    @Override
    public void clear() {
        try {
            int rowsAffected = jdbcTemplate.update(
                "DELETE FROM eventsourcing.read_model WHERE entity_type = ?", entityType);
            log.info("Cleared {} {} entities", rowsAffected, entityType);
        } catch (DataAccessException e) {
            throw new EntityRepositoryException(EntityRepositoryOperation.CLEAR, "could not clear entities",
                null, e);
        }
    }

    @Override
    public void close() {
        // The JdbcTemplate and its DataSource are owned by the application context
    }

    private T mapEntity(ResultSet rs, int rowNum) throws SQLException {
        try {
            return objectMapper.readValue(rs.getString("data"), entityClass);
        } catch (JsonProcessingException e) {
            throw new SQLException("Invalid " + entityType + " JSON: " + e.getOriginalMessage(), e);
        }
    }
}
