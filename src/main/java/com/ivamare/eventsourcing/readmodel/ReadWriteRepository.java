package com.ivamare.eventsourcing.readmodel;

import com.ivamare.eventsourcing.aggregate.Entity;

/**
 * Read-model repository a projection both updates and queries.
 *
 * @param <T> entity type
 */
public interface ReadWriteRepository<T extends Entity> extends ReadRepository<T>, WriteRepository<T> {

    /**
     * Remove every entity, typically before rebuilding a projection from scratch.
     */
    void clear();
}
