package com.ivamare.eventsourcing.exception;

import com.ivamare.eventsourcing.model.Event;

/**
 * Wraps a failure raised by domain logic or an event handler.
 */
public class HandlingException extends EventSourcingException {

    private final String handlerType;
    private final transient Event event;

    public HandlingException(String handlerType, Event event, Throwable cause) {
        super("could not handle " + (event != null ? "event " + event : "command")
            + (handlerType != null ? " in " + handlerType : "")
            + ": " + (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.handlerType = handlerType;
        this.event = event;
    }

    public HandlingException(String message, Throwable cause) {
        super(message, cause);
        this.handlerType = null;
        this.event = null;
    }

    public String getHandlerType() {
        return handlerType;
    }

    public Event getEvent() {
        return event;
    }
}
