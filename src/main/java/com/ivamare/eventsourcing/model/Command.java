package com.ivamare.eventsourcing.model;

import java.util.UUID;

/**
 * A request to change exactly one aggregate instance.
 *
 * <p>Concrete commands are domain types; the pipeline only needs these three
 * accessors to route and validate them.
 */
public interface Command {

    /**
     * Identifier of the target aggregate. Must not be null or the nil UUID.
     */
    UUID aggregateId();

    /**
     * Type of the target aggregate, used for factory lookup.
     */
    String aggregateType();

    /**
     * Type of the command, used for handler lookup.
     */
    String commandType();
}
