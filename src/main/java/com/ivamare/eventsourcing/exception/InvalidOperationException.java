package com.ivamare.eventsourcing.exception;

/**
 * Thrown when an operation is attempted in a state that does not allow it.
 */
public class InvalidOperationException extends EventSourcingException {

    public InvalidOperationException(String message) {
        super(message);
    }
}
