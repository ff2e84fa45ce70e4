package com.ivamare.eventsourcing.exception;

/**
 * Thrown when a handler with the same identity is registered twice.
 */
public class HandlerAlreadyAddedException extends EventSourcingException {

    private final String handlerType;

    public HandlerAlreadyAddedException(String handlerType) {
        super("handler already added: " + handlerType);
        this.handlerType = handlerType;
    }

    public String getHandlerType() {
        return handlerType;
    }
}
