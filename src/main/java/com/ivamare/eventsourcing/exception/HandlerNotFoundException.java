package com.ivamare.eventsourcing.exception;

/**
 * Thrown when no handler is registered for a command type.
 */
public class HandlerNotFoundException extends EventSourcingException {

    private final String commandType;

    public HandlerNotFoundException(String commandType) {
        super("No handler registered for " + commandType);
        this.commandType = commandType;
    }

    public String getCommandType() {
        return commandType;
    }
}
