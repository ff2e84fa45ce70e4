package com.ivamare.eventsourcing;

import com.ivamare.eventsourcing.outbox.Outbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import jakarta.annotation.PreDestroy;

/**
 * Auto-start configuration for the outbox worker.
 *
 * <p>Enable with:
 * <pre>
 * eventsourcing:
 *   outbox:
 *     auto-start: true
 * </pre>
 *
 * <p>The worker starts once the application is ready, after all handlers have
 * been registered, and stops on shutdown leaving undelivered events pending.
 */
@AutoConfiguration(after = EventSourcingAutoConfiguration.class)
@ConditionalOnBean(Outbox.class)
@ConditionalOnProperty(prefix = "eventsourcing.outbox", name = "auto-start", havingValue = "true")
public class OutboxAutoStartConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OutboxAutoStartConfiguration.class);

    private final Outbox outbox;

    public OutboxAutoStartConfiguration(Outbox outbox) {
        this.outbox = outbox;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startOutbox() {
        outbox.start();
        log.info("Started outbox worker with {} pending events", outbox.pendingCount());
    }

    @PreDestroy
    public void stopOutbox() {
        if (!outbox.isRunning()) {
            return;
        }
        log.info("Stopping outbox worker...");
        outbox.close();
        log.info("Outbox worker stopped");
    }
}
