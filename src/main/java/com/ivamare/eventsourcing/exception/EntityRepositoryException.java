package com.ivamare.eventsourcing.exception;

import java.util.UUID;

/**
 * Thrown when a read-model repository cannot complete an operation.
 */
public class EntityRepositoryException extends EventSourcingException {

    private final EntityRepositoryOperation operation;
    private final UUID entityId;

    public EntityRepositoryException(EntityRepositoryOperation operation, String message,
                                     UUID entityId, Throwable cause) {
        super(format(operation, message, entityId), cause);
        this.operation = operation;
        this.entityId = entityId;
    }

    private static String format(EntityRepositoryOperation operation, String message, UUID entityId) {
        StringBuilder sb = new StringBuilder("repo: ").append(operation.getValue()).append(": ").append(message);
        if (entityId != null) {
            sb.append(" (entity ").append(entityId).append(")");
        }
        return sb.toString();
    }

    public EntityRepositoryOperation getOperation() {
        return operation;
    }

    /**
     * @return the entity involved, null for operations on the whole repository
     */
    public UUID getEntityId() {
        return entityId;
    }
}
