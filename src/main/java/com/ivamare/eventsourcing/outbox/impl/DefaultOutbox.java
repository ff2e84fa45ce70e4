package com.ivamare.eventsourcing.outbox.impl;

import com.ivamare.eventsourcing.EventSourcingProperties.OutboxProperties;
import com.ivamare.eventsourcing.exception.DatabaseExceptionClassifier;
import com.ivamare.eventsourcing.exception.HandlerAlreadyAddedException;
import com.ivamare.eventsourcing.exception.InvalidOperationException;
import com.ivamare.eventsourcing.exception.MissingHandlerException;
import com.ivamare.eventsourcing.exception.MissingMatcherException;
import com.ivamare.eventsourcing.handler.ErrorChannel;
import com.ivamare.eventsourcing.handler.EventHandler;
import com.ivamare.eventsourcing.matcher.EventMatcher;
import com.ivamare.eventsourcing.model.Event;
import com.ivamare.eventsourcing.model.HandlerContext;
import com.ivamare.eventsourcing.model.OutboxRecord;
import com.ivamare.eventsourcing.outbox.Outbox;
import com.ivamare.eventsourcing.outbox.OutboxError;
import com.ivamare.eventsourcing.outbox.OutboxStore;
import com.ivamare.eventsourcing.policy.BackoffPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Outbox delivering pending records from an {@link OutboxStore} on one background thread.
 *
 * <p>Each pass reads the due records oldest first. Once a record of an aggregate
 * fails, the rest of that aggregate's records wait for the next pass, which keeps
 * per-aggregate version order. A record is removed only when every matching
 * handler succeeded; otherwise it is rescheduled with capped exponential backoff
 * and one {@link OutboxError} per failing handler is published.
 */
public class DefaultOutbox implements Outbox {

    private static final Logger log = LoggerFactory.getLogger(DefaultOutbox.class);

    private final OutboxStore store;
    private final BackoffPolicy backoffPolicy;
    private final int pollIntervalMs;
    private final int batchSize;
    private final int errorThreshold;
    private final Duration shutdownTimeout;
    private final Clock clock;
    private final ErrorChannel<OutboxError> errors;

    private final ReadWriteLock registrationLock = new ReentrantReadWriteLock();
    private final List<Registration> registrations = new ArrayList<>();
    private final Set<String> handlerTypes = new HashSet<>();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicInteger inFlightCount = new AtomicInteger(0);
    private final AtomicInteger consecutiveErrors = new AtomicInteger(0);
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    // Guarded by this
    private ExecutorService executor;

    /**
     * Creates an outbox with default settings.
     *
     * @param store pending record storage
     */
    public DefaultOutbox(OutboxStore store) {
        this(store, new OutboxProperties());
    }

    /**
     * Creates an outbox configured from properties.
     *
     * @param store pending record storage
     * @param properties worker and backoff settings
     */
    public DefaultOutbox(OutboxStore store, OutboxProperties properties) {
        this(
            store,
            new BackoffPolicy(
                properties.getBackoff().getInitialBackoffMs(),
                properties.getBackoff().getMaxBackoffMs(),
                properties.getBackoff().getBackoffMultiplier()
            ),
            properties.getPollIntervalMs(),
            properties.getBatchSize(),
            properties.getBackoff().getErrorThreshold(),
            properties.getErrorBufferSize(),
            Duration.ofMillis(properties.getShutdownTimeoutMs()),
            Clock.systemUTC()
        );
    }

    /**
     * Creates an outbox.
     *
     * @param store pending record storage
     * @param backoffPolicy delay before redelivery and after storage errors
     * @param pollIntervalMs pause between polls when nothing is due
     * @param batchSize maximum records per poll
     * @param errorThreshold failures after which logging escalates to ERROR
     * @param errorBufferSize buffered errors per subscriber
     * @param shutdownTimeout how long close waits for the in-flight delivery
     * @param clock time source for scheduling redelivery
     */
    public DefaultOutbox(
            OutboxStore store,
            BackoffPolicy backoffPolicy,
            int pollIntervalMs,
            int batchSize,
            int errorThreshold,
            int errorBufferSize,
            Duration shutdownTimeout,
            Clock clock) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, was " + batchSize);
        }
        this.store = store;
        this.backoffPolicy = backoffPolicy;
        this.pollIntervalMs = pollIntervalMs;
        this.batchSize = batchSize;
        this.errorThreshold = errorThreshold;
        this.shutdownTimeout = shutdownTimeout;
        this.clock = clock;
        this.errors = new ErrorChannel<>(errorBufferSize);
    }

    // --- Registration ---

    @Override
    public void addHandler(EventMatcher matcher, EventHandler handler) {
        if (matcher == null) {
            throw new MissingMatcherException();
        }
        if (handler == null) {
            throw new MissingHandlerException();
        }

        registrationLock.writeLock().lock();
        try {
            if (!handlerTypes.add(handler.handlerType())) {
                throw new HandlerAlreadyAddedException(handler.handlerType());
            }
            registrations.add(new Registration(matcher, handler));
        } finally {
            registrationLock.writeLock().unlock();
        }
        log.debug("Added outbox handler {}", handler.handlerType());
    }

    // --- Ingestion ---

    @Override
    public void enqueue(HandlerContext context, List<Event> events) {
        if (events == null || events.isEmpty()) {
            return;
        }
        store.append(context.values(), events);
        log.debug("Enqueued {} events for {} {}",
            events.size(), events.get(0).aggregateType(), events.get(0).aggregateId());
    }

    // --- Lifecycle ---

    @Override
    public synchronized void start() {
        if (closed.get()) {
            throw new InvalidOperationException("Outbox is closed");
        }
        if (running.getAndSet(true)) {
            log.warn("Outbox already running");
            return;
        }

        stopping.set(false);
        executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "outbox-worker");
            thread.setDaemon(true);
            return thread;
        });

        log.info("Starting outbox (pollIntervalMs={}, batchSize={})", pollIntervalMs, batchSize);

        executor.submit(this::runLoop);
    }

    @Override
    public synchronized void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (executor == null) {
            running.set(false);
            return;
        }

        stopping.set(true);
        stopSignal.countDown();
        log.info("Stopping outbox, waiting for {} in-flight deliveries", inFlightCount.get());

        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Timeout waiting for {} in-flight deliveries, interrupting", inFlightCount.get());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        running.set(false);
        log.info("Outbox stopped with {} pending records", pendingCountSafely());
    }

    @Override
    public ErrorChannel.Subscription<OutboxError> errors() {
        return errors.subscribe();
    }

    @Override
    public boolean isRunning() {
        return running.get() && !stopping.get();
    }

    @Override
    public long pendingCount() {
        return store.count();
    }

    @Override
    public int consecutiveErrorCount() {
        return consecutiveErrors.get();
    }

    // --- Main Processing Loop ---

    private void runLoop() {
        log.debug("Outbox loop started");

        try {
            while (running.get() && !stopping.get()) {
                try {
                    int processed = processPending();
                    consecutiveErrors.set(0);
                    if (stopping.get()) {
                        return;
                    }
                    if (processed < batchSize) {
                        sleep(pollIntervalMs);
                    }
                } catch (Exception e) {
                    if (!stopping.get()) {
                        int errorCount = consecutiveErrors.incrementAndGet();
                        long backoff = backoffPolicy.delayMs(errorCount);

                        if (DatabaseExceptionClassifier.isTransient(e)) {
                            logStorageError(errorCount, backoff, e);
                        } else {
                            log.error("Non-transient error in outbox loop: {}", e.getMessage(), e);
                        }

                        sleep(backoff);
                    }
                }
            }
        } finally {
            running.set(false);
            log.debug("Outbox loop ended");
        }
    }

    /**
     * Deliver one batch of due records.
     *
     * @return number of records read
     */
    int processPending() {
        List<OutboxRecord> batch = store.pendingDue(clock.instant(), batchSize);
        Set<UUID> blocked = new HashSet<>();

        for (OutboxRecord record : batch) {
            if (stopping.get()) {
                break;
            }
            UUID aggregateId = record.event().aggregateId();
            if (blocked.contains(aggregateId)) {
                continue;
            }

            inFlightCount.incrementAndGet();
            try {
                if (deliver(record)) {
                    store.markDelivered(record.id());
                } else {
                    blocked.add(aggregateId);
                }
            } finally {
                inFlightCount.decrementAndGet();
            }
        }
        return batch.size();
    }

    private boolean deliver(OutboxRecord record) {
        Event event = record.event();
        HandlerContext context = record.handlerContext();
        int attempt = record.attempts() + 1;

        List<Registration> matching = new ArrayList<>();
        registrationLock.readLock().lock();
        try {
            for (Registration registration : registrations) {
                if (registration.matcher().matches(event)) {
                    matching.add(registration);
                }
            }
        } finally {
            registrationLock.readLock().unlock();
        }

        List<OutboxError> failures = new ArrayList<>();
        for (Registration registration : matching) {
            try {
                registration.handler().handleEvent(context, event);
            } catch (Exception e) {
                failures.add(new OutboxError(event, registration.handler().handlerType(), e, attempt));
            }
        }

        if (failures.isEmpty()) {
            log.debug("Delivered {} to {} handlers", event, matching.size());
            return true;
        }

        Instant nextAttemptAt = backoffPolicy.nextAttemptAt(clock.instant(), attempt);
        store.markFailed(record.id(), attempt, nextAttemptAt, failures.get(0).message());

        for (OutboxError failure : failures) {
            if (attempt >= errorThreshold) {
                log.error("Delivery of {} to {} failed (attempt={}), retrying at {}: {}",
                    event, failure.handlerType(), attempt, nextAttemptAt, failure.error().getMessage());
            } else {
                log.warn("Delivery of {} to {} failed (attempt={}), retrying at {}: {}",
                    event, failure.handlerType(), attempt, nextAttemptAt, failure.error().getMessage());
            }
            errors.publish(failure);
        }
        return false;
    }

    private void logStorageError(int errorCount, long backoffMs, Exception e) {
        String reason = DatabaseExceptionClassifier.getTransientReason(e);
        String message = "Outbox storage error (count={}, reason={}), backing off {}ms: {}";

        if (errorCount >= errorThreshold) {
            log.error(message, errorCount, reason, backoffMs, e.getMessage());
        } else {
            log.warn(message, errorCount, reason, backoffMs, e.getMessage());
        }
    }

    private void sleep(long ms) {
        try {
            stopSignal.await(ms, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopping.set(true);
        }
    }

    private long pendingCountSafely() {
        try {
            return store.count();
        } catch (RuntimeException e) {
            log.debug("Could not count pending records: {}", e.getMessage());
            return -1;
        }
    }

    private record Registration(EventMatcher matcher, EventHandler handler) {}
}
