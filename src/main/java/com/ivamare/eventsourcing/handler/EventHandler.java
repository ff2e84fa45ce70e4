package com.ivamare.eventsourcing.handler;

import com.ivamare.eventsourcing.model.Event;
import com.ivamare.eventsourcing.model.HandlerContext;

/**
 * Receives delivered events.
 *
 * <p>Delivery is at-least-once, so implementations must be idempotent.
 * {@link #handlerType()} is the handler's identity: a bus or outbox accepts each
 * identity once.
 */
public interface EventHandler {

    /**
     * @return unique identity of this handler
     */
    String handlerType();

    /**
     * Handle one event.
     *
     * @param context the context the event was committed with
     * @param event the event
     * @throws Exception if handling failed and the event should be redelivered
     */
    void handleEvent(HandlerContext context, Event event) throws Exception;

    /**
     * Create a handler from a function.
     */
    static EventHandler of(String handlerType, EventHandlerFunction function) {
        if (handlerType == null || handlerType.isBlank()) {
            throw new IllegalArgumentException("handlerType is required");
        }
        return new FunctionEventHandler(handlerType, function);
    }

    /**
     * Functional form of {@link EventHandler#handleEvent}.
     */
    @FunctionalInterface
    interface EventHandlerFunction {
        void handle(HandlerContext context, Event event) throws Exception;
    }

    record FunctionEventHandler(String handlerType, EventHandlerFunction function) implements EventHandler {

        @Override
        public void handleEvent(HandlerContext context, Event event) throws Exception {
            function.handle(context, event);
        }
    }
}
