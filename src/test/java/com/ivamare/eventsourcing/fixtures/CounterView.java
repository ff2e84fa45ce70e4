package com.ivamare.eventsourcing.fixtures;

import com.ivamare.eventsourcing.aggregate.Entity;

import java.util.UUID;

/**
 * Read-model row for {@link CounterAggregate}.
 */
public record CounterView(UUID id, String name, int count) implements Entity {

    @Override
    public UUID entityId() {
        return id;
    }

    public CounterView increment() {
        return new CounterView(id, name, count + 1);
    }

    public CounterView rename(String newName) {
        return new CounterView(id, newName, count);
    }
}
