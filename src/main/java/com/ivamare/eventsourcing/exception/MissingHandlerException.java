package com.ivamare.eventsourcing.exception;

/**
 * Thrown when a registration is attempted without a handler.
 */
public class MissingHandlerException extends EventSourcingException {

    public MissingHandlerException() {
        super("missing handler");
    }
}
