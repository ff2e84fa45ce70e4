package com.ivamare.eventsourcing.exception;

import com.ivamare.eventsourcing.model.Event;

import java.util.List;
import java.util.UUID;

/**
 * Thrown for malformed input such as an empty batch or non-contiguous versions.
 *
 * <p>Always a caller bug, never retried.
 */
public class InvalidInputException extends EventStoreException {

    public InvalidInputException(EventStoreOperation operation, String reason, String aggregateType,
                                 UUID aggregateId, int version, List<Event> events) {
        super(operation, reason, aggregateType, aggregateId, version, events);
    }
}
