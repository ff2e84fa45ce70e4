package com.ivamare.eventsourcing.handler;

import java.util.List;
import java.util.Objects;

/**
 * Applies middleware lists to handlers at wiring time.
 *
 * <p>The first middleware in the list becomes the outermost wrapper, so on a call
 * its before-logic runs first and its after-logic runs last.
 */
public final class Middlewares {

    private Middlewares() {
    }

    public static CommandHandler useCommandHandlerMiddleware(
            CommandHandler handler, List<CommandHandlerMiddleware> middlewares) {
        Objects.requireNonNull(handler, "handler");
        CommandHandler wrapped = handler;
        for (int i = middlewares.size() - 1; i >= 0; i--) {
            wrapped = middlewares.get(i).apply(wrapped);
        }
        return wrapped;
    }

    public static CommandHandler useCommandHandlerMiddleware(
            CommandHandler handler, CommandHandlerMiddleware... middlewares) {
        return useCommandHandlerMiddleware(handler, List.of(middlewares));
    }

    public static EventHandler useEventHandlerMiddleware(
            EventHandler handler, List<EventHandlerMiddleware> middlewares) {
        Objects.requireNonNull(handler, "handler");
        EventHandler wrapped = handler;
        for (int i = middlewares.size() - 1; i >= 0; i--) {
            wrapped = middlewares.get(i).apply(wrapped);
        }
        return wrapped;
    }

    public static EventHandler useEventHandlerMiddleware(
            EventHandler handler, EventHandlerMiddleware... middlewares) {
        return useEventHandlerMiddleware(handler, List.of(middlewares));
    }
}
