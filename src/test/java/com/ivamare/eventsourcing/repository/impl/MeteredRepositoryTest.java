package com.ivamare.eventsourcing.repository.impl;

import com.ivamare.eventsourcing.exception.AggregateNotFoundException;
import com.ivamare.eventsourcing.exception.ConcurrencyConflictException;
import com.ivamare.eventsourcing.exception.EventStoreOperation;
import com.ivamare.eventsourcing.fixtures.CounterAggregate;
import com.ivamare.eventsourcing.model.HandlerContext;
import com.ivamare.eventsourcing.repository.Repository;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MeteredRepositoryTest {

    @Mock
    private Repository inner;

    private SimpleMeterRegistry registry;
    private MeteredRepository repository;
    private final HandlerContext ctx = HandlerContext.empty();
    private final UUID id = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        repository = new MeteredRepository(inner, registry);
    }

    private long count(String timer, String outcome) {
        Timer found = registry.find(timer).tags("aggregate_type", "Counter", "outcome", outcome).timer();
        return found == null ? 0 : found.count();
    }

    @Test
    void shouldTimeSuccessfulLoad() {
        CounterAggregate counter = new CounterAggregate(id);
        when(inner.load(ctx, "Counter", id)).thenReturn(counter);

        assertSame(counter, repository.load(ctx, "Counter", id));
        assertEquals(1, count(MeteredRepository.LOAD_TIMER, "success"));
    }

    @Test
    void shouldTagNotFound() {
        when(inner.load(ctx, "Counter", id))
            .thenThrow(new AggregateNotFoundException(EventStoreOperation.LOAD, "Counter", id, 0));

        assertThrows(AggregateNotFoundException.class, () -> repository.load(ctx, "Counter", id));
        assertEquals(1, count(MeteredRepository.LOAD_TIMER, "not_found"));
    }

    @Test
    void shouldTagConflictOnSave() {
        CounterAggregate counter = new CounterAggregate(id);
        doThrow(new ConcurrencyConflictException("Counter", id, 0, 1, List.of()))
            .when(inner).save(ctx, counter);

        assertThrows(ConcurrencyConflictException.class, () -> repository.save(ctx, counter));
        assertEquals(1, count(MeteredRepository.SAVE_TIMER, "conflict"));
    }

    @Test
    void shouldTagOtherErrors() {
        CounterAggregate counter = new CounterAggregate(id);
        doThrow(new IllegalStateException("boom")).when(inner).save(ctx, counter);

        assertThrows(IllegalStateException.class, () -> repository.save(ctx, counter));
        assertEquals(1, count(MeteredRepository.SAVE_TIMER, "error"));
    }

    @Test
    void shouldExposeInnerRepository() {
        assertSame(inner, repository.innerRepository().orElseThrow());
    }
}
