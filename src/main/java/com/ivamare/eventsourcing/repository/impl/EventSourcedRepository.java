package com.ivamare.eventsourcing.repository.impl;

import com.ivamare.eventsourcing.aggregate.Aggregate;
import com.ivamare.eventsourcing.aggregate.AggregateFactoryRegistry;
import com.ivamare.eventsourcing.aggregate.Snapshotable;
import com.ivamare.eventsourcing.eventstore.EventStore;
import com.ivamare.eventsourcing.exception.AggregateNotFoundException;
import com.ivamare.eventsourcing.exception.EventSourcingException;
import com.ivamare.eventsourcing.model.Event;
import com.ivamare.eventsourcing.model.HandlerContext;
import com.ivamare.eventsourcing.model.Snapshot;
import com.ivamare.eventsourcing.outbox.Outbox;
import com.ivamare.eventsourcing.repository.Repository;
import com.ivamare.eventsourcing.snapshot.SnapshotStore;
import com.ivamare.eventsourcing.snapshot.SnapshotStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Repository rebuilding aggregates from the event store, optionally starting
 * from a snapshot.
 *
 * <p>On save the events are written and handed to the outbox. With a
 * {@link TransactionTemplate} both writes share one transaction, so the outbox
 * record is exactly as durable as the events. Without one, the two writes run
 * under a per-aggregate lock so outbox records of an aggregate are appended in
 * version order.
 */
public class EventSourcedRepository implements Repository {

    private static final Logger log = LoggerFactory.getLogger(EventSourcedRepository.class);

    private static final int COMMIT_LOCK_STRIPES = 64;

    private final EventStore eventStore;
    private final AggregateFactoryRegistry factoryRegistry;
    private final SnapshotStore snapshotStore;
    private final SnapshotStrategy snapshotStrategy;
    private final Outbox outbox;
    private final TransactionTemplate transactionTemplate;
    private final Lock[] commitLocks = new Lock[COMMIT_LOCK_STRIPES];

    /**
     * Creates a repository without snapshots, outbox or transaction.
     */
    public EventSourcedRepository(EventStore eventStore, AggregateFactoryRegistry factoryRegistry) {
        this(eventStore, factoryRegistry, null, SnapshotStrategy.never(), null, null);
    }

    /**
     * Creates a repository.
     *
     * @param eventStore event store
     * @param factoryRegistry creates empty aggregates by type
     * @param snapshotStore snapshot store (nullable)
     * @param snapshotStrategy decides when to snapshot after a save
     * @param outbox outbox receiving committed events (nullable)
     * @param transactionTemplate transaction spanning event and outbox writes (nullable)
     */
    public EventSourcedRepository(
            EventStore eventStore,
            AggregateFactoryRegistry factoryRegistry,
            SnapshotStore snapshotStore,
            SnapshotStrategy snapshotStrategy,
            Outbox outbox,
            TransactionTemplate transactionTemplate) {
        this.eventStore = eventStore;
        this.factoryRegistry = factoryRegistry;
        this.snapshotStore = snapshotStore;
        this.snapshotStrategy = snapshotStrategy != null ? snapshotStrategy : SnapshotStrategy.never();
        this.outbox = outbox;
        this.transactionTemplate = transactionTemplate;
        for (int i = 0; i < commitLocks.length; i++) {
            commitLocks[i] = new ReentrantLock();
        }
    }

    @Override
    public Aggregate load(HandlerContext context, String aggregateType, UUID aggregateId) {
        context.checkActive();

        if (snapshotStore != null) {
            Optional<Aggregate> fromSnapshot = loadFromSnapshot(context, aggregateType, aggregateId);
            if (fromSnapshot.isPresent()) {
                return fromSnapshot.get();
            }
        }

        Aggregate aggregate = factoryRegistry.create(aggregateType, aggregateId);
        context.checkActive();
        List<Event> events = eventStore.load(aggregateId);
        applyEvents(aggregate, events);

        log.debug("Loaded {} {} at v{} by replaying {} events",
            aggregateType, aggregateId, aggregate.aggregateVersion(), events.size());
        return aggregate;
    }

    /**
     * Snapshot followed by the newer events, or empty whenever the snapshot
     * cannot be trusted and a full replay is needed.
     */
    private Optional<Aggregate> loadFromSnapshot(HandlerContext context, String aggregateType, UUID aggregateId) {
        Aggregate aggregate = factoryRegistry.create(aggregateType, aggregateId);
        if (!(aggregate instanceof Snapshotable snapshotable)) {
            return Optional.empty();
        }

        Snapshot snapshot;
        try {
            Optional<Snapshot> loaded = snapshotStore.loadSnapshot(aggregateId);
            if (loaded.isEmpty()) {
                return Optional.empty();
            }
            snapshot = loaded.get();
        } catch (EventSourcingException e) {
            log.warn("Could not load snapshot for {} {}, replaying all events: {}",
                aggregateType, aggregateId, e.getMessage());
            return Optional.empty();
        }

        if (!aggregateType.equals(snapshot.aggregateType())) {
            log.warn("Snapshot for {} has type {} but {} was requested, replaying all events",
                aggregateId, snapshot.aggregateType(), aggregateType);
            return Optional.empty();
        }

        try {
            snapshotable.applySnapshot(snapshot);
        } catch (RuntimeException e) {
            log.warn("Could not apply snapshot v{} to {} {}, replaying all events: {}",
                snapshot.version(), aggregateType, aggregateId, e.getMessage());
            return Optional.empty();
        }
        aggregate.setAggregateVersion(snapshot.version());

        context.checkActive();
        List<Event> newer;
        try {
            newer = eventStore.loadFrom(aggregateId, snapshot.version() + 1);
        } catch (AggregateNotFoundException e) {
            // Nothing after the snapshot
            log.debug("Loaded {} {} from snapshot v{}", aggregateType, aggregateId, snapshot.version());
            return Optional.of(aggregate);
        }

        if (newer.get(0).version() != snapshot.version() + 1) {
            log.warn("Events after snapshot v{} of {} {} start at v{}, replaying all events",
                snapshot.version(), aggregateType, aggregateId, newer.get(0).version());
            return Optional.empty();
        }

        applyEvents(aggregate, newer);
        log.debug("Loaded {} {} at v{} from snapshot v{} and {} events",
            aggregateType, aggregateId, aggregate.aggregateVersion(), snapshot.version(), newer.size());
        return Optional.of(aggregate);
    }

    private void applyEvents(Aggregate aggregate, List<Event> events) {
        for (Event event : events) {
            aggregate.applyEvent(event);
            aggregate.setAggregateVersion(event.version());
        }
    }

    @Override
    public void save(HandlerContext context, Aggregate aggregate) {
        List<Event> events = aggregate.uncommittedEvents();
        if (events.isEmpty()) {
            return;
        }

        context.checkActive();
        int expectedVersion = aggregate.aggregateVersion();

        if (transactionTemplate != null) {
            transactionTemplate.execute(status -> {
                commit(context, events, expectedVersion);
                return null;
            });
        } else if (outbox != null) {
            Lock lock = commitLock(aggregate.entityId());
            lock.lock();
            try {
                commit(context, events, expectedVersion);
            } finally {
                lock.unlock();
            }
        } else {
            commit(context, events, expectedVersion);
        }

        aggregate.setAggregateVersion(events.get(events.size() - 1).version());
        aggregate.clearUncommittedEvents();

        log.debug("Saved {} {} at v{} ({} events)",
            aggregate.aggregateType(), aggregate.entityId(), aggregate.aggregateVersion(), events.size());

        takeSnapshotIfNeeded(aggregate, events);
    }

    private void commit(HandlerContext context, List<Event> events, int expectedVersion) {
        eventStore.save(events, expectedVersion);
        if (outbox != null) {
            outbox.enqueue(context, events);
        }
    }

    private Lock commitLock(UUID aggregateId) {
        return commitLocks[Math.floorMod(aggregateId.hashCode(), commitLocks.length)];
    }

    private void takeSnapshotIfNeeded(Aggregate aggregate, List<Event> committed) {
        if (snapshotStore == null
                || !(aggregate instanceof Snapshotable snapshotable)
                || !snapshotStrategy.shouldTakeSnapshot(aggregate, committed)) {
            return;
        }
        try {
            Snapshot snapshot = snapshotable.createSnapshot();
            snapshotStore.saveSnapshot(aggregate.entityId(), snapshot);
            log.debug("Took snapshot of {} {} at v{}",
                aggregate.aggregateType(), aggregate.entityId(), snapshot.version());
        } catch (RuntimeException e) {
            // The events are committed, a missing snapshot only costs replay time
            log.error("Failed to take snapshot of {} {} at v{}",
                aggregate.aggregateType(), aggregate.entityId(), aggregate.aggregateVersion(), e);
        }
    }
}
