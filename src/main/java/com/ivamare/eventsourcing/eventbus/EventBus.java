package com.ivamare.eventsourcing.eventbus;

import com.ivamare.eventsourcing.exception.HandlingException;
import com.ivamare.eventsourcing.handler.ErrorChannel;
import com.ivamare.eventsourcing.handler.EventHandler;
import com.ivamare.eventsourcing.matcher.EventMatcher;

/**
 * In-process fan-out of delivered events to registered (matcher, handler) pairs.
 *
 * <p>The bus is itself an event handler, so it can be registered with an outbox
 * under a single identity. {@link #handleEvent} invokes every matching handler and
 * fails if any of them failed, which keeps the event pending in the outbox.
 */
public interface EventBus extends EventHandler, AutoCloseable {

    /**
     * Register a handler.
     *
     * @throws com.ivamare.eventsourcing.exception.MissingMatcherException if matcher is null
     * @throws com.ivamare.eventsourcing.exception.MissingHandlerException if handler is null
     * @throws com.ivamare.eventsourcing.exception.HandlerAlreadyAddedException if a handler
     *         with the same type is already registered
     */
    void addHandler(EventMatcher matcher, EventHandler handler);

    /**
     * Subscribe to handler failures.
     */
    ErrorChannel.Subscription<HandlingException> errors();

    /**
     * Stop accepting events once in-flight dispatches have finished.
     */
    @Override
    void close();
}
