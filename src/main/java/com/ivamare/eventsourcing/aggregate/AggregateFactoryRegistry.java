package com.ivamare.eventsourcing.aggregate;

import com.ivamare.eventsourcing.exception.TypeAlreadyRegisteredException;
import com.ivamare.eventsourcing.exception.TypeNotRegisteredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Maps aggregate type names to factories creating empty aggregates.
 *
 * <p>Owned by the composition root. Registration happens during wiring;
 * lookups afterwards are read-only.
 */
public class AggregateFactoryRegistry {

    private static final Logger log = LoggerFactory.getLogger(AggregateFactoryRegistry.class);

    private final Map<String, Function<UUID, ? extends Aggregate>> factories = new ConcurrentHashMap<>();

    /**
     * Register the factory for an aggregate type.
     *
     * @param aggregateType the aggregate type name
     * @param factory creates an empty aggregate for an id
     * @throws TypeAlreadyRegisteredException if the type already has a factory
     */
    public void register(String aggregateType, Function<UUID, ? extends Aggregate> factory) {
        if (aggregateType == null || aggregateType.isBlank()) {
            throw new IllegalArgumentException("aggregateType is required");
        }
        Objects.requireNonNull(factory, "factory");

        if (factories.putIfAbsent(aggregateType, factory) != null) {
            throw new TypeAlreadyRegisteredException("aggregate", aggregateType);
        }
        log.debug("Registered aggregate factory for {}", aggregateType);
    }

    /**
     * Create an empty aggregate at version 0.
     *
     * @throws TypeNotRegisteredException if no factory is registered
     */
    public Aggregate create(String aggregateType, UUID id) {
        Function<UUID, ? extends Aggregate> factory = factories.get(aggregateType);
        if (factory == null) {
            throw new TypeNotRegisteredException("aggregate", aggregateType);
        }
        Aggregate aggregate = factory.apply(id);
        if (aggregate == null
                || !aggregateType.equals(aggregate.aggregateType())
                || !id.equals(aggregate.entityId())) {
            throw new IllegalStateException(
                "Factory for " + aggregateType + " did not create an aggregate of that type with id " + id);
        }
        return aggregate;
    }

    public boolean isRegistered(String aggregateType) {
        return factories.containsKey(aggregateType);
    }

    public Set<String> registeredTypes() {
        return Set.copyOf(factories.keySet());
    }
}
