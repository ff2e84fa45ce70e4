package com.ivamare.eventsourcing.aggregate;

import com.ivamare.eventsourcing.exception.TypeAlreadyRegisteredException;
import com.ivamare.eventsourcing.exception.TypeNotRegisteredException;
import com.ivamare.eventsourcing.fixtures.CounterAggregate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AggregateFactoryRegistryTest {

    private AggregateFactoryRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new AggregateFactoryRegistry();
    }

    @Test
    void shouldCreateRegisteredAggregate() {
        registry.register(CounterAggregate.TYPE, CounterAggregate::new);
        UUID id = UUID.randomUUID();

        Aggregate aggregate = registry.create(CounterAggregate.TYPE, id);

        assertInstanceOf(CounterAggregate.class, aggregate);
        assertEquals(id, aggregate.entityId());
        assertEquals(0, aggregate.aggregateVersion());
    }

    @Test
    void shouldRejectDuplicateRegistration() {
        registry.register(CounterAggregate.TYPE, CounterAggregate::new);

        TypeAlreadyRegisteredException ex = assertThrows(TypeAlreadyRegisteredException.class,
            () -> registry.register(CounterAggregate.TYPE, CounterAggregate::new));
        assertEquals(CounterAggregate.TYPE, ex.getTypeName());
    }

    @Test
    void shouldRejectUnknownType() {
        assertThrows(TypeNotRegisteredException.class, () -> registry.create("Unknown", UUID.randomUUID()));
    }

    @Test
    void shouldRejectFactoryProducingWrongId() {
        UUID other = UUID.randomUUID();
        registry.register(CounterAggregate.TYPE, id -> new CounterAggregate(other));

        assertThrows(IllegalStateException.class, () -> registry.create(CounterAggregate.TYPE, UUID.randomUUID()));
    }

    @Test
    void shouldListRegisteredTypes() {
        registry.register(CounterAggregate.TYPE, CounterAggregate::new);

        assertTrue(registry.isRegistered(CounterAggregate.TYPE));
        assertFalse(registry.isRegistered("Order"));
        assertEquals(Set.of(CounterAggregate.TYPE), registry.registeredTypes());
    }
}
