package com.ivamare.eventsourcing.exception;

/**
 * Event store operations, reported in {@link EventStoreException}.
 */
public enum EventStoreOperation {
    SAVE("save"),
    LOAD("load"),
    LOAD_FROM("load from"),
    REPLACE("replace"),
    RENAME("rename");

    private final String value;

    EventStoreOperation(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
