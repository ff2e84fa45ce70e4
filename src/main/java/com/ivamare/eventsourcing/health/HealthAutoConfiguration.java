package com.ivamare.eventsourcing.health;

import com.ivamare.eventsourcing.EventSourcingAutoConfiguration;
import com.ivamare.eventsourcing.EventSourcingProperties;
import com.ivamare.eventsourcing.outbox.Outbox;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for event sourcing health indicators.
 */
@AutoConfiguration(after = EventSourcingAutoConfiguration.class)
@ConditionalOnClass(HealthIndicator.class)
@ConditionalOnBean({Outbox.class, EventSourcingProperties.class})
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(OutboxHealthIndicator.class)
    public OutboxHealthIndicator outboxHealthIndicator(Outbox outbox, EventSourcingProperties properties) {
        return new OutboxHealthIndicator(outbox, properties.getOutbox().getBackoff().getErrorThreshold());
    }
}
