package com.ivamare.eventsourcing.health;

import com.ivamare.eventsourcing.outbox.Outbox;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Health indicator for the outbox worker.
 *
 * <p>Down when the worker is not running or keeps failing to reach storage.
 */
public class OutboxHealthIndicator implements HealthIndicator {

    private final Outbox outbox;
    private final int errorThreshold;

    public OutboxHealthIndicator(Outbox outbox, int errorThreshold) {
        this.outbox = outbox;
        this.errorThreshold = errorThreshold;
    }

    @Override
    public Health health() {
        boolean running = outbox.isRunning();
        int consecutiveErrors = outbox.consecutiveErrorCount();
        Health.Builder builder = running && consecutiveErrors < errorThreshold ? Health.up() : Health.down();

        builder.withDetail("running", running)
            .withDetail("consecutiveErrors", consecutiveErrors);
        try {
            builder.withDetail("pending", outbox.pendingCount());
        } catch (RuntimeException e) {
            builder.down().withDetail("pendingError", e.getMessage());
        }
        return builder.build();
    }
}
