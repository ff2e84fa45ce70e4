package com.ivamare.eventsourcing.exception;

import java.util.UUID;

/**
 * Thrown when a snapshot cannot be read, written or applied.
 */
public class SnapshotStoreException extends EventSourcingException {

    private final UUID aggregateId;

    public SnapshotStoreException(String message, UUID aggregateId, Throwable cause) {
        super("snapshot store: " + message + " (" + aggregateId + ")", cause);
        this.aggregateId = aggregateId;
    }

    public UUID getAggregateId() {
        return aggregateId;
    }
}
