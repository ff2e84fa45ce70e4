package com.ivamare.eventsourcing.eventbus.impl;

import com.ivamare.eventsourcing.eventbus.EventBus;
import com.ivamare.eventsourcing.exception.HandlerAlreadyAddedException;
import com.ivamare.eventsourcing.exception.HandlingException;
import com.ivamare.eventsourcing.exception.InvalidOperationException;
import com.ivamare.eventsourcing.exception.MissingHandlerException;
import com.ivamare.eventsourcing.exception.MissingMatcherException;
import com.ivamare.eventsourcing.handler.ErrorChannel;
import com.ivamare.eventsourcing.handler.EventHandler;
import com.ivamare.eventsourcing.matcher.EventMatcher;
import com.ivamare.eventsourcing.model.Event;
import com.ivamare.eventsourcing.model.HandlerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Event bus dispatching on the caller's thread.
 *
 * <p>Dispatches hold the read lock, registration and close hold the write lock,
 * so many events can be dispatched at once and close waits for them to finish.
 * Handlers must not register other handlers from inside {@code handleEvent}.
 */
public class DefaultEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(DefaultEventBus.class);

    public static final String DEFAULT_HANDLER_TYPE = "eventbus";

    private final String handlerType;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<Registration> registrations = new ArrayList<>();
    private final Set<String> handlerTypes = new HashSet<>();
    private final ErrorChannel<HandlingException> errors;
    private boolean closed;

    public DefaultEventBus() {
        this(DEFAULT_HANDLER_TYPE, 256);
    }

    public DefaultEventBus(String handlerType, int errorBufferSize) {
        this.handlerType = handlerType;
        this.errors = new ErrorChannel<>(errorBufferSize);
    }

    @Override
    public String handlerType() {
        return handlerType;
    }

    @Override
    public void addHandler(EventMatcher matcher, EventHandler handler) {
        if (matcher == null) {
            throw new MissingMatcherException();
        }
        if (handler == null) {
            throw new MissingHandlerException();
        }

        lock.writeLock().lock();
        try {
            if (closed) {
                throw new InvalidOperationException("Event bus is closed");
            }
            if (!handlerTypes.add(handler.handlerType())) {
                throw new HandlerAlreadyAddedException(handler.handlerType());
            }
            registrations.add(new Registration(matcher, handler));
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Added event handler {} to {}", handler.handlerType(), handlerType);
    }

    @Override
    public void handleEvent(HandlerContext context, Event event) {
        HandlingException failure = null;

        lock.readLock().lock();
        try {
            if (closed) {
                throw new InvalidOperationException("Event bus is closed");
            }
            for (Registration registration : registrations) {
                if (!registration.matcher().matches(event)) {
                    continue;
                }
                try {
                    registration.handler().handleEvent(context, event);
                } catch (Exception e) {
                    HandlingException handlingError = new HandlingException(
                        registration.handler().handlerType(), event, e);
                    log.warn("Event handler {} failed for {}: {}",
                        registration.handler().handlerType(), event, e.getMessage());
                    errors.publish(handlingError);
                    if (failure == null) {
                        failure = handlingError;
                    } else {
                        failure.addSuppressed(handlingError);
                    }
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public ErrorChannel.Subscription<HandlingException> errors() {
        return errors.subscribe();
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (!closed) {
                closed = true;
                log.info("Event bus {} closed with {} handlers", handlerType, registrations.size());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private record Registration(EventMatcher matcher, EventHandler handler) {}
}
