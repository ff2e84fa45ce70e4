package com.ivamare.eventsourcing.readmodel.impl;

import com.ivamare.eventsourcing.aggregate.Entity;
import com.ivamare.eventsourcing.exception.EntityRepositoryException;
import com.ivamare.eventsourcing.exception.EntityRepositoryOperation;
import com.ivamare.eventsourcing.readmodel.ReadWriteRepository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-model repository kept in memory. Entities are stored by reference, so
 * they should be immutable.
 *
 * @param <T> entity type
 */
public class InMemoryEntityRepository<T extends Entity> implements ReadWriteRepository<T> {

    private final Map<UUID, T> entities = new ConcurrentHashMap<>();
    private volatile boolean closed;

    @Override
    public Optional<T> find(UUID id) {
        checkOpen(EntityRepositoryOperation.FIND, id);
        return id == null ? Optional.empty() : Optional.ofNullable(entities.get(id));
    }

    @Override
    public List<T> findAll() {
        checkOpen(EntityRepositoryOperation.FIND_ALL, null);
        return List.copyOf(entities.values());
    }

    @Override
    public void save(T entity) {
        UUID id = entity == null ? null : entity.entityId();
        checkOpen(EntityRepositoryOperation.SAVE, id);
        if (id == null) {
            throw new EntityRepositoryException(EntityRepositoryOperation.SAVE, "missing entity id", null, null);
        }
        entities.put(id, entity);
    }

    @Override
    public boolean remove(UUID id) {
        checkOpen(EntityRepositoryOperation.REMOVE, id);
        return id != null && entities.remove(id) != null;
    }

    @Override
    public void clear() {
        checkOpen(EntityRepositoryOperation.CLEAR, null);
        entities.clear();
    }

    @Override
    public void close() {
        closed = true;
    }

    private void checkOpen(EntityRepositoryOperation operation, UUID id) {
        if (closed) {
            throw new EntityRepositoryException(operation, "repository is closed", id, null);
        }
    }
}
