package com.ivamare.eventsourcing.eventstore.impl;

import com.ivamare.eventsourcing.eventstore.EventBatchValidator;
import com.ivamare.eventsourcing.eventstore.EventStore;
import com.ivamare.eventsourcing.eventstore.EventStoreMaintenance;
import com.ivamare.eventsourcing.exception.AggregateNotFoundException;
import com.ivamare.eventsourcing.exception.ConcurrencyConflictException;
import com.ivamare.eventsourcing.exception.EventStoreOperation;
import com.ivamare.eventsourcing.exception.InvalidOperationException;
import com.ivamare.eventsourcing.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Event store keeping each aggregate's stream in memory.
 *
 * <p>The compare-and-append runs inside {@link ConcurrentHashMap#compute}, which
 * serializes writers of one aggregate only. Streams are immutable lists replaced
 * on every append, so readers never see a partial batch.
 */
public class InMemoryEventStore implements EventStore, EventStoreMaintenance {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final Map<UUID, List<Event>> streams = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    @Override
    public void save(List<Event> events, int expectedVersion) {
        ensureOpen();
        EventBatchValidator.validate(events, expectedVersion);

        Event first = events.get(0);
        UUID aggregateId = first.aggregateId();

        streams.compute(aggregateId, (id, existing) -> {
            int current = existing == null ? 0 : existing.size();
            if (current != expectedVersion) {
                throw new ConcurrencyConflictException(
                    first.aggregateType(), aggregateId, expectedVersion, current, events);
            }
            List<Event> appended = new ArrayList<>(current + events.size());
            if (existing != null) {
                appended.addAll(existing);
            }
            appended.addAll(events);
            return Collections.unmodifiableList(appended);
        });

        log.debug("Saved {} events for {} {} (v{} -> v{})",
            events.size(), first.aggregateType(), aggregateId,
            expectedVersion, expectedVersion + events.size());
    }

    @Override
    public List<Event> load(UUID aggregateId) {
        ensureOpen();
        List<Event> stream = streams.get(aggregateId);
        if (stream == null || stream.isEmpty()) {
            throw new AggregateNotFoundException(EventStoreOperation.LOAD, null, aggregateId, 0);
        }
        return stream;
    }

    @Override
    public List<Event> loadFrom(UUID aggregateId, int version) {
        ensureOpen();
        List<Event> stream = streams.get(aggregateId);
        if (stream == null || stream.size() < Math.max(version, 1)) {
            String type = stream == null || stream.isEmpty() ? null : stream.get(0).aggregateType();
            throw new AggregateNotFoundException(EventStoreOperation.LOAD_FROM, type, aggregateId, version);
        }
        // Versions are 1..n, so version v sits at index v - 1
        return stream.subList(Math.max(version, 1) - 1, stream.size());
    }

    @Override
    public void replace(Event event) {
        ensureOpen();
        AtomicBoolean replaced = new AtomicBoolean(false);
        streams.computeIfPresent(event.aggregateId(), (id, existing) -> {
            if (event.version() > existing.size()) {
                return existing;
            }
            List<Event> copy = new ArrayList<>(existing);
            copy.set(event.version() - 1, event);
            replaced.set(true);
            return Collections.unmodifiableList(copy);
        });
        if (!replaced.get()) {
            throw new AggregateNotFoundException(EventStoreOperation.REPLACE,
                event.aggregateType(), event.aggregateId(), event.version());
        }
        log.info("Replaced event {} v{} of {} {}",
            event.eventType(), event.version(), event.aggregateType(), event.aggregateId());
    }

    @Override
    public int renameEvent(String fromEventType, String toEventType) {
        ensureOpen();
        AtomicInteger renamed = new AtomicInteger();
        for (UUID aggregateId : streams.keySet()) {
            streams.computeIfPresent(aggregateId, (id, existing) -> {
                if (existing.stream().noneMatch(e -> e.eventType().equals(fromEventType))) {
                    return existing;
                }
                List<Event> copy = new ArrayList<>(existing.size());
                for (Event e : existing) {
                    if (e.eventType().equals(fromEventType)) {
                        copy.add(e.withEventType(toEventType));
                        renamed.incrementAndGet();
                    } else {
                        copy.add(e);
                    }
                }
                return Collections.unmodifiableList(copy);
            });
        }
        log.info("Renamed {} events from {} to {}", renamed.get(), fromEventType, toEventType);
        return renamed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.debug("In-memory event store closed with {} streams", streams.size());
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new InvalidOperationException("Event store is closed");
        }
    }
}
