package com.ivamare.eventsourcing;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Configuration properties for event sourcing.
 *
 * <p>Example configuration:
 * <pre>
 * eventsourcing:
 *   enabled: true
 *   storage: jdbc
 *   snapshot:
 *     every-number-of-events: 100
 *   command:
 *     max-attempts: 3
 *     backoff-schedule-ms: [10, 50, 100]
 *   outbox:
 *     auto-start: true
 *     poll-interval-ms: 500
 *     batch-size: 100
 *     shutdown-timeout-ms: 5000
 *     error-buffer-size: 256
 *     backoff:
 *       initial-backoff-ms: 1000
 *       max-backoff-ms: 60000
 *       backoff-multiplier: 2.0
 *       error-threshold: 5
 * </pre>
 */
@ConfigurationProperties(prefix = "eventsourcing")
public class EventSourcingProperties {

    /**
     * Enable/disable event sourcing auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Storage backend for events, snapshots and the outbox.
     */
    private Storage storage = Storage.JDBC;

    private SnapshotProperties snapshot = new SnapshotProperties();

    private CommandProperties command = new CommandProperties();

    private OutboxProperties outbox = new OutboxProperties();

    public enum Storage {
        JDBC,
        IN_MEMORY
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public SnapshotProperties getSnapshot() {
        return snapshot;
    }

    public void setSnapshot(SnapshotProperties snapshot) {
        this.snapshot = snapshot;
    }

    public CommandProperties getCommand() {
        return command;
    }

    public void setCommand(CommandProperties command) {
        this.command = command;
    }

    public OutboxProperties getOutbox() {
        return outbox;
    }

    public void setOutbox(OutboxProperties outbox) {
        this.outbox = outbox;
    }

    /**
     * Snapshot configuration properties.
     */
    public static class SnapshotProperties {

        /**
         * Take a snapshot every N events. 0 disables snapshots.
         */
        private int everyNumberOfEvents = 0;

        public int getEveryNumberOfEvents() {
            return everyNumberOfEvents;
        }

        public void setEveryNumberOfEvents(int everyNumberOfEvents) {
            this.everyNumberOfEvents = everyNumberOfEvents;
        }
    }

    /**
     * Command pipeline configuration properties.
     */
    public static class CommandProperties {

        /**
         * Maximum attempts for a command that hits a concurrency conflict.
         */
        private int maxAttempts = 3;

        /**
         * Delay in milliseconds before each retry.
         */
        private List<Integer> backoffScheduleMs = List.of(10, 50, 100);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public List<Integer> getBackoffScheduleMs() {
            return backoffScheduleMs;
        }

        public void setBackoffScheduleMs(List<Integer> backoffScheduleMs) {
            this.backoffScheduleMs = backoffScheduleMs;
        }
    }

    /**
     * Outbox worker configuration properties.
     */
    public static class OutboxProperties {

        /**
         * Start the outbox worker when the application is ready.
         */
        private boolean autoStart = false;

        /**
         * Pause between polls when nothing is due.
         */
        private int pollIntervalMs = 500;

        /**
         * Maximum records read per poll.
         */
        private int batchSize = 100;

        /**
         * How long close waits for the in-flight delivery.
         */
        private long shutdownTimeoutMs = 5000;

        /**
         * Buffered errors per error subscriber before the oldest is dropped.
         */
        private int errorBufferSize = 256;

        private BackoffProperties backoff = new BackoffProperties();

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public int getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getShutdownTimeoutMs() {
            return shutdownTimeoutMs;
        }

        public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
            this.shutdownTimeoutMs = shutdownTimeoutMs;
        }

        public int getErrorBufferSize() {
            return errorBufferSize;
        }

        public void setErrorBufferSize(int errorBufferSize) {
            this.errorBufferSize = errorBufferSize;
        }

        public BackoffProperties getBackoff() {
            return backoff;
        }

        public void setBackoff(BackoffProperties backoff) {
            this.backoff = backoff;
        }
    }

    /**
     * Backoff for failed deliveries and storage errors in the outbox loop.
     */
    public static class BackoffProperties {

        /**
         * Initial backoff delay in milliseconds.
         */
        private long initialBackoffMs = 1000;

        /**
         * Maximum backoff delay in milliseconds.
         */
        private long maxBackoffMs = 60000;

        /**
         * Multiplier for exponential backoff.
         */
        private double backoffMultiplier = 2.0;

        /**
         * Failures after which logging escalates from WARN to ERROR.
         */
        private int errorThreshold = 5;

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public int getErrorThreshold() {
            return errorThreshold;
        }

        public void setErrorThreshold(int errorThreshold) {
            this.errorThreshold = errorThreshold;
        }
    }
}
