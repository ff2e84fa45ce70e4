package com.ivamare.eventsourcing.exception;

import java.util.List;
import java.util.UUID;

/**
 * Thrown when an aggregate has no events (at or after the requested version).
 */
public class AggregateNotFoundException extends EventStoreException {

    public AggregateNotFoundException(EventStoreOperation operation, String aggregateType,
                                      UUID aggregateId, int version) {
        super(operation, "aggregate not found", aggregateType, aggregateId, version, List.of());
    }
}
