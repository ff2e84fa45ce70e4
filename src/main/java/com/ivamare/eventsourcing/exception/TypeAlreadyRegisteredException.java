package com.ivamare.eventsourcing.exception;

/**
 * Thrown when a factory is registered twice for the same type name.
 */
public class TypeAlreadyRegisteredException extends EventSourcingException {

    private final String typeName;

    public TypeAlreadyRegisteredException(String kind, String typeName) {
        super(kind + " type already registered: " + typeName);
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
