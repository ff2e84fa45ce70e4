package com.ivamare.eventsourcing.handler;

import com.ivamare.eventsourcing.model.Command;
import com.ivamare.eventsourcing.model.HandlerContext;

/**
 * Functional interface for command handlers.
 *
 * <p>Runs synchronously from the caller's point of view. Middlewares wrap a
 * handler into another handler with the same contract.
 */
@FunctionalInterface
public interface CommandHandler {

    /**
     * Handle a command.
     *
     * @param context the request context
     * @param command the command
     * @throws Exception if the command failed
     */
    void handleCommand(HandlerContext context, Command command) throws Exception;
}
