package com.ivamare.eventsourcing.eventstore;

import com.ivamare.eventsourcing.exception.EventStoreOperation;
import com.ivamare.eventsourcing.exception.InvalidInputException;
import com.ivamare.eventsourcing.model.Event;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Input checks shared by all event store implementations before a save.
 */
public final class EventBatchValidator {

    private EventBatchValidator() {
    }

    /**
     * Validate a batch of events for {@link EventStore#save}.
     *
     * @throws InvalidInputException if the batch is empty, spans several aggregates
     *         or its versions do not continue {@code expectedVersion} without gaps
     */
    public static void validate(List<Event> events, int expectedVersion) {
        if (events == null || events.isEmpty()) {
            throw new InvalidInputException(EventStoreOperation.SAVE, "missing events",
                null, null, expectedVersion, List.of());
        }

        if (events.stream().anyMatch(Objects::isNull)) {
            throw new InvalidInputException(EventStoreOperation.SAVE, "null event in batch",
                null, null, expectedVersion, List.of());
        }

        Event first = events.get(0);
        UUID aggregateId = first.aggregateId();
        String aggregateType = first.aggregateType();

        if (expectedVersion < 0) {
            throw new InvalidInputException(EventStoreOperation.SAVE,
                "expected version must not be negative", aggregateType, aggregateId, expectedVersion, events);
        }

        int nextVersion = expectedVersion + 1;
        for (Event event : events) {
            if (!aggregateId.equals(event.aggregateId())) {
                throw new InvalidInputException(EventStoreOperation.SAVE,
                    "events belong to different aggregates", aggregateType, aggregateId, expectedVersion, events);
            }
            if (!aggregateType.equals(event.aggregateType())) {
                throw new InvalidInputException(EventStoreOperation.SAVE,
                    "events belong to different aggregate types", aggregateType, aggregateId, expectedVersion, events);
            }
            if (event.version() != nextVersion) {
                throw new InvalidInputException(EventStoreOperation.SAVE,
                    "incorrect event version, expected " + nextVersion + " but was " + event.version(),
                    aggregateType, aggregateId, expectedVersion, events);
            }
            nextVersion++;
        }
    }
}
