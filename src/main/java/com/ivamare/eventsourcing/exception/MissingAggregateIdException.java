package com.ivamare.eventsourcing.exception;

/**
 * Thrown when a command is dispatched without an aggregate id.
 */
public class MissingAggregateIdException extends EventSourcingException {

    private final String commandType;

    public MissingAggregateIdException(String commandType) {
        super("missing aggregate ID" + (commandType != null ? " in " + commandType : ""));
        this.commandType = commandType;
    }

    public String getCommandType() {
        return commandType;
    }
}
