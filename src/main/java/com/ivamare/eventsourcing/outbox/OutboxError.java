package com.ivamare.eventsourcing.outbox;

import com.ivamare.eventsourcing.model.Event;

/**
 * A failed delivery attempt of one event to one handler.
 *
 * @param event the event that could not be delivered
 * @param handlerType the failing handler
 * @param error the failure
 * @param attempt delivery attempt number (1-based)
 */
public record OutboxError(
    Event event,
    String handlerType,
    Throwable error,
    int attempt
) {
    public String message() {
        return "outbox error: " + (error != null ? error.getMessage() : "unknown") + " [" + event + "]";
    }

    @Override
    public String toString() {
        return message();
    }
}
