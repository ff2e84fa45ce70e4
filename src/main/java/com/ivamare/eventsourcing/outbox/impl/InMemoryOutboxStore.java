package com.ivamare.eventsourcing.outbox.impl;

import com.ivamare.eventsourcing.model.Event;
import com.ivamare.eventsourcing.model.OutboxRecord;
import com.ivamare.eventsourcing.outbox.OutboxStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox store kept in memory. Pending records do not survive a restart.
 */
public class InMemoryOutboxStore implements OutboxStore {

    private final ConcurrentNavigableMap<Long, OutboxRecord> records = new ConcurrentSkipListMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public synchronized void append(Map<String, Object> context, List<Event> events) {
        for (Event event : events) {
            long id = sequence.incrementAndGet();
            records.put(id, new OutboxRecord(id, event, context, 0, Instant.EPOCH, null));
        }
    }

    @Override
    public List<OutboxRecord> pendingDue(Instant now, int limit) {
        List<OutboxRecord> due = new ArrayList<>();
        Set<UUID> backingOff = new HashSet<>();
        for (OutboxRecord record : records.values()) {
            if (due.size() >= limit) {
                break;
            }
            UUID aggregateId = record.event().aggregateId();
            if (!record.isDue(now)) {
                backingOff.add(aggregateId);
            } else if (!backingOff.contains(aggregateId)) {
                due.add(record);
            }
        }
        return due;
    }

    @Override
    public void markDelivered(long id) {
        records.remove(id);
    }

    @Override
    public void markFailed(long id, int attempts, Instant nextAttemptAt, String error) {
        records.computeIfPresent(id, (key, record) ->
            new OutboxRecord(id, record.event(), record.context(), attempts, nextAttemptAt, error));
    }

    @Override
    public long count() {
        return records.size();
    }
}
