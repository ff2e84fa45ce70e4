package com.ivamare.eventsourcing.readmodel;

import com.ivamare.eventsourcing.aggregate.Entity;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read side of a read-model repository, the store projections query.
 *
 * <p>Like {@link com.ivamare.eventsourcing.repository.Repository}, read
 * repositories may wrap one another and expose the wrapped one.
 *
 * @param <T> entity type
 */
public interface ReadRepository<T extends Entity> extends AutoCloseable {

    /**
     * @throws com.ivamare.eventsourcing.exception.EntityRepositoryException if storage fails
     */
    Optional<T> find(UUID id);

    /**
     * @return every stored entity, in no particular order
     * @throws com.ivamare.eventsourcing.exception.EntityRepositoryException if storage fails
     */
    List<T> findAll();

    /**
     * @return the wrapped repository, empty for a base repository
     */
    default Optional<ReadRepository<T>> innerRepository() {
        return Optional.empty();
    }

    @Override
    void close();
}
