package com.ivamare.eventsourcing.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event waiting in the outbox for delivery.
 *
 * @param id Sequence number assigned on append, increasing in commit order
 * @param event The committed event
 * @param context Context values captured when the event was committed
 * @param attempts Delivery attempts made so far
 * @param nextAttemptAt Earliest time of the next delivery attempt
 * @param lastError Message of the last delivery failure (nullable)
 */
public record OutboxRecord(
    long id,
    Event event,
    Map<String, Object> context,
    int attempts,
    Instant nextAttemptAt,
    String lastError
) {
    public OutboxRecord {
        if (event == null) {
            throw new IllegalArgumentException("event is required");
        }
        context = context == null || context.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        if (nextAttemptAt == null) {
            nextAttemptAt = Instant.EPOCH;
        }
    }

    /**
     * Whether the record is due for delivery at the given time.
     */
    public boolean isDue(Instant now) {
        return !nextAttemptAt.isAfter(now);
    }

    /**
     * The context to hand to event handlers on delivery.
     */
    public HandlerContext handlerContext() {
        return HandlerContext.of(context);
    }
}
