package com.ivamare.eventsourcing.handler;

import com.ivamare.eventsourcing.model.Command;
import com.ivamare.eventsourcing.model.HandlerContext;

import java.util.Set;

/**
 * Routes commands to the handler registered for their command type.
 */
public interface CommandDispatcher {

    /**
     * Register a handler for a command type. Configured middlewares are applied once, here.
     *
     * @throws com.ivamare.eventsourcing.exception.HandlerAlreadyAddedException if the
     *         command type already has a handler
     */
    void register(String commandType, CommandHandler handler);

    /**
     * Handle a command with its registered handler.
     *
     * @throws com.ivamare.eventsourcing.exception.HandlerNotFoundException if none is registered
     * @throws Exception whatever the handler chain throws
     */
    void dispatch(HandlerContext context, Command command) throws Exception;

    boolean hasHandler(String commandType);

    Set<String> registeredCommandTypes();
}
