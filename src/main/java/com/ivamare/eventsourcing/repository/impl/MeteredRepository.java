package com.ivamare.eventsourcing.repository.impl;

import com.ivamare.eventsourcing.aggregate.Aggregate;
import com.ivamare.eventsourcing.exception.AggregateNotFoundException;
import com.ivamare.eventsourcing.exception.ConcurrencyConflictException;
import com.ivamare.eventsourcing.model.HandlerContext;
import com.ivamare.eventsourcing.repository.Repository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository layer recording load and save timings.
 *
 * <p>Timers {@code eventsourcing.repository.load} and {@code eventsourcing.repository.save}
 * are tagged with the aggregate type and an outcome. Both calls always go to the
 * inner repository.
 */
public class MeteredRepository implements Repository {

    static final String LOAD_TIMER = "eventsourcing.repository.load";
    static final String SAVE_TIMER = "eventsourcing.repository.save";

    private final Repository inner;
    private final MeterRegistry meterRegistry;

    public MeteredRepository(Repository inner, MeterRegistry meterRegistry) {
        this.inner = inner;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public Aggregate load(HandlerContext context, String aggregateType, UUID aggregateId) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "error";
        try {
            Aggregate aggregate = inner.load(context, aggregateType, aggregateId);
            outcome = "success";
            return aggregate;
        } catch (AggregateNotFoundException e) {
            outcome = "not_found";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer(LOAD_TIMER, "aggregate_type", aggregateType, "outcome", outcome));
        }
    }

    @Override
    public void save(HandlerContext context, Aggregate aggregate) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "error";
        try {
            inner.save(context, aggregate);
            outcome = "success";
        } catch (ConcurrencyConflictException e) {
            outcome = "conflict";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer(SAVE_TIMER,
                "aggregate_type", aggregate.aggregateType(), "outcome", outcome));
        }
    }

    @Override
    public Optional<Repository> innerRepository() {
        return Optional.of(inner);
    }
}
