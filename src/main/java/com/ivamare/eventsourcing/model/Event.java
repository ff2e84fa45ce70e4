package com.ivamare.eventsourcing.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * An immutable fact describing a past change to one aggregate.
 *
 * <p>For a fixed aggregate id the stored versions are exactly {@code 1, 2, 3, ...}.
 * The payload is opaque to the store and the dispatch code; only the codec
 * boundary interprets it.
 *
 * @param eventType The type of event (e.g., "OrderCreated")
 * @param aggregateType The type of aggregate the event belongs to (e.g., "Order")
 * @param aggregateId Identifier of the aggregate instance
 * @param version Version of the aggregate after this event (1-based)
 * @param timestamp When the event was created
 * @param data Opaque payload
 * @param metadata Ordered key/value metadata
 */
public record Event(
    String eventType,
    String aggregateType,
    UUID aggregateId,
    int version,
    Instant timestamp,
    byte[] data,
    Map<String, Object> metadata
) {
    /**
     * Creates an event with validation.
     */
    public Event {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType is required");
        }
        if (aggregateType == null || aggregateType.isBlank()) {
            throw new IllegalArgumentException("aggregateType is required");
        }
        if (aggregateId == null) {
            throw new IllegalArgumentException("aggregateId is required");
        }
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1, was " + version);
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        data = data == null ? new byte[0] : data.clone();
        metadata = metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Create an event without metadata.
     */
    public static Event create(String eventType, String aggregateType, UUID aggregateId,
                               int version, Instant timestamp, byte[] data) {
        return new Event(eventType, aggregateType, aggregateId, version, timestamp, data, Map.of());
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    /**
     * Copy of this event under a different event type.
     */
    public Event withEventType(String newEventType) {
        return new Event(newEventType, aggregateType, aggregateId, version, timestamp, data, metadata);
    }

    /**
     * Copy of this event with a replaced payload.
     */
    public Event withData(byte[] newData) {
        return new Event(eventType, aggregateType, aggregateId, version, timestamp, newData, metadata);
    }

    /**
     * Copy of this event with one more metadata entry.
     */
    public Event withMetadata(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new Event(eventType, aggregateType, aggregateId, version, timestamp, data, copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Event other)) {
            return false;
        }
        return version == other.version
            && eventType.equals(other.eventType)
            && aggregateType.equals(other.aggregateType)
            && aggregateId.equals(other.aggregateId)
            && timestamp.equals(other.timestamp)
            && Arrays.equals(data, other.data)
            && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(eventType, aggregateType, aggregateId, version, timestamp, metadata);
        return 31 * result + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return eventType + "@" + version + " [" + aggregateType + " " + aggregateId + "]";
    }
}
