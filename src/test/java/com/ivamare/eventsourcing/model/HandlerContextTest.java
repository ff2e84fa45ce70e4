package com.ivamare.eventsourcing.model;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

class HandlerContextTest {

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void emptyContextShouldBeActive() {
        HandlerContext context = HandlerContext.empty();

        assertTrue(context.values().isEmpty());
        assertFalse(context.isCancelled());
        assertDoesNotThrow(context::checkActive);
    }

    @Test
    void withValueShouldNotModifyOriginal() {
        HandlerContext original = HandlerContext.of(Map.of("user", "alice"));

        HandlerContext extended = original.withValue("tenant", "acme");

        assertEquals(1, original.values().size());
        assertEquals("acme", extended.value("tenant").orElseThrow());
        assertEquals("alice", extended.value("user").orElseThrow());
    }

    @Test
    void shouldBeCancelledAfterDeadline() {
        HandlerContext context = HandlerContext.empty().withDeadline(Instant.now().minusSeconds(1));

        assertTrue(context.isCancelled());
        CancellationException ex = assertThrows(CancellationException.class, context::checkActive);
        assertTrue(ex.getMessage().contains("deadline"));
    }

    @Test
    void shouldNotBeCancelledBeforeDeadline() {
        HandlerContext context = HandlerContext.empty().withDeadline(Instant.now().plusSeconds(60));

        assertFalse(context.isCancelled());
    }

    @Test
    void shouldBeCancelledWhenThreadInterrupted() {
        Thread.currentThread().interrupt();

        assertThrows(CancellationException.class, () -> HandlerContext.empty().checkActive());
    }
}
