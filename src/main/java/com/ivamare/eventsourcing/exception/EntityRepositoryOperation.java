package com.ivamare.eventsourcing.exception;

/**
 * Read-model repository operations, reported in {@link EntityRepositoryException}.
 */
public enum EntityRepositoryOperation {
    FIND("find"),
    FIND_ALL("find all"),
    SAVE("save"),
    REMOVE("remove"),
    CLEAR("clear");

    private final String value;

    EntityRepositoryOperation(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
