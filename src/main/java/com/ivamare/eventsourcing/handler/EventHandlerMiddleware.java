package com.ivamare.eventsourcing.handler;

/**
 * Wraps an event handler. The wrapper should keep the wrapped handler's type.
 */
@FunctionalInterface
public interface EventHandlerMiddleware {

    EventHandler apply(EventHandler next);
}
