package com.ivamare.eventsourcing.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class OutboxRecordTest {

    private final Event event = Event.create("Created", "Order", UUID.randomUUID(), 1, Instant.now(), new byte[0]);

    @Test
    void shouldBeDueWhenNextAttemptNotInFuture() {
        Instant now = Instant.parse("2024-01-01T00:00:00Z");

        assertTrue(new OutboxRecord(1, event, Map.of(), 0, now, null).isDue(now));
        assertTrue(new OutboxRecord(1, event, Map.of(), 0, null, null).isDue(now));
        assertFalse(new OutboxRecord(1, event, Map.of(), 1, now.plusMillis(1), "boom").isDue(now));
    }

    @Test
    void shouldCarryContextToHandlers() {
        Map<String, Object> context = new HashMap<>();
        context.put("user", "alice");
        context.put("trace", null);

        OutboxRecord record = new OutboxRecord(1, event, context, 0, null, null);

        assertEquals("alice", record.handlerContext().value("user").orElseThrow());
        assertTrue(record.handlerContext().value("trace").isEmpty());
    }
}
