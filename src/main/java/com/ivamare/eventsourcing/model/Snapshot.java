package com.ivamare.eventsourcing.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * A cached aggregate state at a given version.
 *
 * <p>Never authoritative: events after {@link #version()} are always replayed on top.
 *
 * @param aggregateId Identifier of the aggregate
 * @param aggregateType The type of aggregate the state belongs to
 * @param version Aggregate version at capture time
 * @param timestamp When the snapshot was taken
 * @param state Opaque serialized state
 */
public record Snapshot(
    UUID aggregateId,
    String aggregateType,
    int version,
    Instant timestamp,
    byte[] state
) {
    public Snapshot {
        if (aggregateId == null) {
            throw new IllegalArgumentException("aggregateId is required");
        }
        if (aggregateType == null || aggregateType.isBlank()) {
            throw new IllegalArgumentException("aggregateType is required");
        }
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1, was " + version);
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        state = state == null ? new byte[0] : state.clone();
    }

    @Override
    public byte[] state() {
        return state.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Snapshot other)) {
            return false;
        }
        return version == other.version
            && aggregateId.equals(other.aggregateId)
            && aggregateType.equals(other.aggregateType)
            && timestamp.equals(other.timestamp)
            && Arrays.equals(state, other.state);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(aggregateId, aggregateType, version, timestamp) + Arrays.hashCode(state);
    }

    @Override
    public String toString() {
        return "Snapshot[" + aggregateType + " " + aggregateId + " v" + version + "]";
    }
}
