package com.ivamare.eventsourcing.model;

/**
 * Options relaxing {@link EventComparison}.
 */
public enum CompareOption {
    IGNORE_TIMESTAMP,
    IGNORE_VERSION,
    /**
     * Ignore the {@code position} metadata entry some stores add on load.
     */
    IGNORE_POSITION_METADATA
}
