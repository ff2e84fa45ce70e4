package com.ivamare.eventsourcing.exception;

/**
 * Thrown when no factory is registered for a type name.
 */
public class TypeNotRegisteredException extends EventSourcingException {

    private final String typeName;

    public TypeNotRegisteredException(String kind, String typeName) {
        super(kind + " type not registered: " + typeName);
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
