package com.ivamare.eventsourcing.handler;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Broadcast channel for asynchronous failures.
 *
 * <p>Every {@link #subscribe()} gets its own bounded buffer and sees every error
 * published after it subscribed. Publishing never blocks: when a subscriber's
 * buffer is full its oldest entry is dropped and counted. With no subscribers
 * errors are discarded.
 *
 * @param <T> the error type
 */
public class ErrorChannel<T> {

    private final int bufferSize;
    private final List<Subscription<T>> subscriptions = new CopyOnWriteArrayList<>();

    public ErrorChannel(int bufferSize) {
        if (bufferSize < 1) {
            throw new IllegalArgumentException("bufferSize must be >= 1, was " + bufferSize);
        }
        this.bufferSize = bufferSize;
    }

    /**
     * Deliver an error to every current subscriber.
     */
    public void publish(T error) {
        for (Subscription<T> subscription : subscriptions) {
            subscription.offer(error);
        }
    }

    public Subscription<T> subscribe() {
        Subscription<T> subscription = new Subscription<>(this, bufferSize);
        subscriptions.add(subscription);
        return subscription;
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    /**
     * One consumer's view of the channel.
     */
    public static final class Subscription<T> implements AutoCloseable {

        private final ErrorChannel<T> channel;
        private final int capacity;
        private final Deque<T> buffer;
        private final ReentrantLock lock = new ReentrantLock();
        private final Condition notEmpty = lock.newCondition();
        private final AtomicLong dropped = new AtomicLong();

        private Subscription(ErrorChannel<T> channel, int capacity) {
            this.channel = channel;
            this.capacity = capacity;
            this.buffer = new ArrayDeque<>(Math.min(capacity, 64));
        }

        private void offer(T error) {
            lock.lock();
            try {
                if (buffer.size() >= capacity) {
                    buffer.pollFirst();
                    dropped.incrementAndGet();
                }
                buffer.addLast(error);
                notEmpty.signalAll();
            } finally {
                lock.unlock();
            }
        }

        /**
         * @return the oldest buffered error, if any
         */
        public Optional<T> poll() {
            lock.lock();
            try {
                return Optional.ofNullable(buffer.pollFirst());
            } finally {
                lock.unlock();
            }
        }

        /**
         * Wait up to {@code timeout} for an error.
         */
        public Optional<T> poll(Duration timeout) throws InterruptedException {
            long nanos = timeout.toNanos();
            lock.lock();
            try {
                while (buffer.isEmpty()) {
                    if (nanos <= 0) {
                        return Optional.empty();
                    }
                    nanos = notEmpty.awaitNanos(nanos);
                }
                return Optional.of(buffer.pollFirst());
            } finally {
                lock.unlock();
            }
        }

        /**
         * Remove and return all buffered errors, oldest first.
         */
        public List<T> drain() {
            lock.lock();
            try {
                List<T> all = new ArrayList<>(buffer);
                buffer.clear();
                return all;
            } finally {
                lock.unlock();
            }
        }

        /**
         * @return number of errors dropped because the buffer was full
         */
        public long droppedCount() {
            return dropped.get();
        }

        @Override
        public void close() {
            channel.subscriptions.remove(this);
        }
    }
}
