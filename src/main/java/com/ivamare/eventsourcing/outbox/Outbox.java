package com.ivamare.eventsourcing.outbox;

import com.ivamare.eventsourcing.handler.ErrorChannel;
import com.ivamare.eventsourcing.handler.EventHandler;
import com.ivamare.eventsourcing.matcher.EventMatcher;
import com.ivamare.eventsourcing.model.Event;
import com.ivamare.eventsourcing.model.HandlerContext;

import java.util.List;

/**
 * Durable staging area between committed events and their subscribers.
 *
 * <p>The repository enqueues events as part of a successful save. A background
 * worker delivers each pending event to every matching handler and removes it
 * only when all of them succeeded, so delivery is at-least-once and survives
 * restarts. Failures are retried with capped exponential backoff and reported on
 * {@link #errors()}; they never reach the command caller.
 */
public interface Outbox extends AutoCloseable {

    /**
     * Register a handler for the events selected by a matcher.
     *
     * @throws com.ivamare.eventsourcing.exception.MissingMatcherException if matcher is null
     * @throws com.ivamare.eventsourcing.exception.MissingHandlerException if handler is null
     * @throws com.ivamare.eventsourcing.exception.HandlerAlreadyAddedException if a handler
     *         with the same type is already registered
     */
    void addHandler(EventMatcher matcher, EventHandler handler);

    /**
     * Durably record committed events as pending delivery.
     *
     * @param context the context to hand to event handlers
     * @param events events in commit order
     */
    void enqueue(HandlerContext context, List<Event> events);

    /**
     * Start the delivery worker. Calling it while running logs a warning and does nothing.
     *
     * @throws com.ivamare.eventsourcing.exception.InvalidOperationException if already closed
     */
    void start();

    /**
     * Stop the worker, letting the in-flight delivery finish. Pending records stay pending.
     */
    @Override
    void close();

    /**
     * Subscribe to delivery failures.
     *
     * <p>Each subscription has its own bounded buffer that drops its oldest
     * entry when full; publication never blocks.
     */
    ErrorChannel.Subscription<OutboxError> errors();

    boolean isRunning();

    /**
     * @return number of records not yet delivered
     */
    long pendingCount();

    /**
     * @return consecutive storage errors seen by the worker loop
     */
    int consecutiveErrorCount();
}
