package com.ivamare.eventsourcing.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Request-scoped context that travels with a command and its events.
 *
 * <p>The same values reach the terminal command handler, the outbox record and
 * every event handler on delivery. An optional deadline, together with thread
 * interruption, acts as the cancellation signal.
 *
 * @param values Context key/value pairs
 * @param deadline Instant after which work should stop (nullable)
 */
public record HandlerContext(
    Map<String, Object> values,
    Instant deadline
) {
    private static final HandlerContext EMPTY = new HandlerContext(Map.of(), null);

    public HandlerContext {
        values = values == null || values.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Context without values or deadline.
     */
    public static HandlerContext empty() {
        return EMPTY;
    }

    /**
     * Context carrying the given values and no deadline.
     */
    public static HandlerContext of(Map<String, Object> values) {
        return new HandlerContext(values, null);
    }

    public HandlerContext withValue(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new HandlerContext(copy, deadline);
    }

    public HandlerContext withDeadline(Instant newDeadline) {
        return new HandlerContext(values, newDeadline);
    }

    public Optional<Object> value(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * Check whether the caller has given up on this request.
     *
     * @return true if the current thread is interrupted or the deadline has passed
     */
    public boolean isCancelled() {
        return Thread.currentThread().isInterrupted()
            || (deadline != null && !Instant.now().isBefore(deadline));
    }

    /**
     * Throw if the request was cancelled. Called at the boundaries before
     * storage and handler calls, never in the middle of a durable write.
     *
     * @throws CancellationException if cancelled
     */
    public void checkActive() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Request interrupted");
        }
        if (deadline != null && !Instant.now().isBefore(deadline)) {
            throw new CancellationException("Request deadline exceeded at " + deadline);
        }
    }
}
