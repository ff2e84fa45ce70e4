package com.ivamare.eventsourcing.exception;

/**
 * Thrown when a handler is registered without a matcher.
 */
public class MissingMatcherException extends EventSourcingException {

    public MissingMatcherException() {
        super("missing matcher");
    }
}
