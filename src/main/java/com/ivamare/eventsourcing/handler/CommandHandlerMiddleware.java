package com.ivamare.eventsourcing.handler;

/**
 * Wraps a command handler to add behavior before and after it.
 */
@FunctionalInterface
public interface CommandHandlerMiddleware {

    CommandHandler apply(CommandHandler next);
}
