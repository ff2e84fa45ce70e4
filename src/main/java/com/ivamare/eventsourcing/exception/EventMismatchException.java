package com.ivamare.eventsourcing.exception;

/**
 * Thrown by event comparison when two events differ.
 */
public class EventMismatchException extends EventSourcingException {

    private final String field;

    public EventMismatchException(String field, Object actual, Object expected) {
        super(field + " mismatch: " + actual + " (should be " + expected + ")");
        this.field = field;
    }

    public EventMismatchException(String message) {
        super(message);
        this.field = null;
    }

    public String getField() {
        return field;
    }
}
