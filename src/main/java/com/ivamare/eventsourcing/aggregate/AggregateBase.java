package com.ivamare.eventsourcing.aggregate;

import com.ivamare.eventsourcing.model.Event;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Base class holding the bookkeeping every aggregate needs: id, type,
 * committed version and the list of uncommitted events.
 *
 * <p>Subclasses implement {@link #handleCommand} and {@link #applyEvent} and call
 * {@link #appendEvent} to record decisions.
 */
public abstract class AggregateBase implements Aggregate {

    private final UUID id;
    private final String aggregateType;
    private final Clock clock;
    private final List<Event> uncommitted = new ArrayList<>();
    private int version;

    protected AggregateBase(String aggregateType, UUID id) {
        this(aggregateType, id, Clock.systemUTC());
    }

    protected AggregateBase(String aggregateType, UUID id, Clock clock) {
        if (aggregateType == null || aggregateType.isBlank()) {
            throw new IllegalArgumentException("aggregateType is required");
        }
        if (id == null) {
            throw new IllegalArgumentException("id is required");
        }
        this.aggregateType = aggregateType;
        this.id = id;
        this.clock = clock;
    }

    @Override
    public UUID entityId() {
        return id;
    }

    @Override
    public String aggregateType() {
        return aggregateType;
    }

    @Override
    public int aggregateVersion() {
        return version;
    }

    @Override
    public void setAggregateVersion(int version) {
        this.version = version;
    }

    @Override
    public List<Event> uncommittedEvents() {
        return Collections.unmodifiableList(new ArrayList<>(uncommitted));
    }

    @Override
    public void clearUncommittedEvents() {
        uncommitted.clear();
    }

    /**
     * Record a new event, numbered after the committed version and any
     * events already pending, and apply it to in-memory state right away.
     *
     * @param eventType the event type
     * @param data opaque payload
     * @return the appended event
     */
    protected Event appendEvent(String eventType, byte[] data) {
        return appendEvent(eventType, data, Map.of());
    }

    protected Event appendEvent(String eventType, byte[] data, Map<String, Object> metadata) {
        Event event = new Event(
            eventType,
            aggregateType,
            id,
            version + uncommitted.size() + 1,
            clock.instant(),
            data,
            metadata
        );
        applyEvent(event);
        uncommitted.add(event);
        return event;
    }
}
