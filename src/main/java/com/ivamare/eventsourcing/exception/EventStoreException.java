package com.ivamare.eventsourcing.exception;

import com.ivamare.eventsourcing.model.Event;

import java.util.List;
import java.util.UUID;

/**
 * Error raised by an event store, carrying the operation and the aggregate it concerned.
 *
 * <p>Message format: {@code event store: <op>: <reason>, <Type>(<id>, v<version>)}.
 */
public class EventStoreException extends EventSourcingException {

    private final EventStoreOperation operation;
    private final String reason;
    private final String aggregateType;
    private final UUID aggregateId;
    private final int aggregateVersion;
    private final List<Event> events;

    public EventStoreException(
            EventStoreOperation operation,
            String reason,
            String aggregateType,
            UUID aggregateId,
            int aggregateVersion,
            List<Event> events) {
        this(operation, reason, aggregateType, aggregateId, aggregateVersion, events, null);
    }

    public EventStoreException(
            EventStoreOperation operation,
            String reason,
            String aggregateType,
            UUID aggregateId,
            int aggregateVersion,
            List<Event> events,
            Throwable cause) {
        super(format(operation, reason, aggregateType, aggregateId, aggregateVersion), cause);
        this.operation = operation;
        this.reason = reason;
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.aggregateVersion = aggregateVersion;
        this.events = events == null ? List.of() : List.copyOf(events);
    }

    private static String format(EventStoreOperation operation, String reason,
                                 String aggregateType, UUID aggregateId, int version) {
        return "event store: " + operation.getValue() + ": " + reason + ", "
            + (aggregateType == null ? "Aggregate" : aggregateType)
            + "(" + aggregateId + ", v" + version + ")";
    }

    public EventStoreOperation getOperation() {
        return operation;
    }

    public String getReason() {
        return reason;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public UUID getAggregateId() {
        return aggregateId;
    }

    public int getAggregateVersion() {
        return aggregateVersion;
    }

    public List<Event> getEvents() {
        return events;
    }
}
