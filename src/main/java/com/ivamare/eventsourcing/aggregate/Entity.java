package com.ivamare.eventsourcing.aggregate;

import java.util.UUID;

/**
 * Anything identified by a UUID.
 */
public interface Entity {

    UUID entityId();
}
