package com.ivamare.eventsourcing.eventstore;

import com.ivamare.eventsourcing.model.Event;

/**
 * Audited maintenance operations that rewrite stored events in place.
 *
 * <p>Neither operation changes an event's aggregate id or version. Use for data
 * migrations only, never from command handling.
 */
public interface EventStoreMaintenance {

    /**
     * Replace the stored event with the same aggregate id and version.
     *
     * @throws com.ivamare.eventsourcing.exception.AggregateNotFoundException if no such event exists
     */
    void replace(Event event);

    /**
     * Rename every stored event of one type.
     *
     * @return number of events renamed
     */
    int renameEvent(String fromEventType, String toEventType);
}
