package com.ivamare.eventsourcing.readmodel;

import com.ivamare.eventsourcing.aggregate.Entity;

import java.util.UUID;

/**
 * Write side of a read-model repository, used by projections.
 *
 * @param <T> entity type
 */
public interface WriteRepository<T extends Entity> {

    /**
     * Insert or replace the entity stored under its id.
     *
     * @throws com.ivamare.eventsourcing.exception.EntityRepositoryException if the entity
     *         or its id is null, or storage fails
     */
    void save(T entity);

    /**
     * @return true if an entity was removed
     * @throws com.ivamare.eventsourcing.exception.EntityRepositoryException if storage fails
     */
    boolean remove(UUID id);
}
