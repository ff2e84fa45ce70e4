package com.ivamare.eventsourcing.outbox;

import com.ivamare.eventsourcing.model.Event;
import com.ivamare.eventsourcing.model.OutboxRecord;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persistence of pending outbox records.
 */
public interface OutboxStore {

    /**
     * Append events as pending records, due immediately, in the given order.
     */
    void append(Map<String, Object> context, List<Event> events);

    /**
     * Records due at {@code now}, oldest first, leaving out every record whose
     * aggregate has an earlier record that is still backing off.
     *
     * @param now current time
     * @param limit maximum number of records
     */
    List<OutboxRecord> pendingDue(Instant now, int limit);

    /**
     * Remove a delivered record.
     */
    void markDelivered(long id);

    /**
     * Record a failed attempt and when to try again.
     */
    void markFailed(long id, int attempts, Instant nextAttemptAt, String error);

    /**
     * @return number of pending records
     */
    long count();
}
