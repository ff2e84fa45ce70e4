package com.ivamare.eventsourcing.aggregate;

import com.ivamare.eventsourcing.model.Command;
import com.ivamare.eventsourcing.model.Event;
import com.ivamare.eventsourcing.model.HandlerContext;

import java.util.List;

/**
 * Consistency boundary and unit of optimistic concurrency.
 *
 * <p>An aggregate is owned by the repository for the duration of one
 * load-handle-save cycle. Domain logic runs in {@link #handleCommand} and records
 * its decisions as uncommitted events; {@link #applyEvent} folds an event into
 * in-memory state, both for new events and during replay.
 *
 * @see AggregateBase
 */
public interface Aggregate extends Entity, Versionable {

    /**
     * @return the aggregate type, used for factory lookup and event matching
     */
    String aggregateType();

    /**
     * Run domain logic for a command, appending uncommitted events.
     *
     * @param context the request context
     * @param command the command to handle
     * @throws Exception if the command is rejected by the domain
     */
    void handleCommand(HandlerContext context, Command command) throws Exception;

    /**
     * Fold an event into in-memory state. Must not change the version.
     *
     * @param event the event to apply
     */
    void applyEvent(Event event);

    /**
     * @return events appended since the last save, oldest first
     */
    List<Event> uncommittedEvents();

    void clearUncommittedEvents();

    /**
     * Set the last committed version. Only called by the repository.
     */
    void setAggregateVersion(int version);
}
