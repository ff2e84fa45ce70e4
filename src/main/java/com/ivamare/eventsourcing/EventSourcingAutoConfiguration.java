package com.ivamare.eventsourcing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventsourcing.aggregate.AggregateFactoryRegistry;
import com.ivamare.eventsourcing.eventbus.EventBus;
import com.ivamare.eventsourcing.eventbus.impl.DefaultEventBus;
import com.ivamare.eventsourcing.eventstore.EventStore;
import com.ivamare.eventsourcing.eventstore.impl.InMemoryEventStore;
import com.ivamare.eventsourcing.eventstore.impl.JdbcEventStore;
import com.ivamare.eventsourcing.handler.CommandDispatcher;
import com.ivamare.eventsourcing.handler.CommandHandlerMiddleware;
import com.ivamare.eventsourcing.handler.impl.DefaultCommandDispatcher;
import com.ivamare.eventsourcing.handler.middleware.LoggingMiddleware;
import com.ivamare.eventsourcing.handler.middleware.MetricsMiddleware;
import com.ivamare.eventsourcing.handler.middleware.RetryOnConflictMiddleware;
import com.ivamare.eventsourcing.matcher.EventMatcher;
import com.ivamare.eventsourcing.outbox.Outbox;
import com.ivamare.eventsourcing.outbox.OutboxStore;
import com.ivamare.eventsourcing.outbox.impl.DefaultOutbox;
import com.ivamare.eventsourcing.outbox.impl.InMemoryOutboxStore;
import com.ivamare.eventsourcing.outbox.impl.JdbcOutboxStore;
import com.ivamare.eventsourcing.policy.RetryPolicy;
import com.ivamare.eventsourcing.repository.Repository;
import com.ivamare.eventsourcing.repository.impl.EventSourcedRepository;
import com.ivamare.eventsourcing.repository.impl.MeteredRepository;
import com.ivamare.eventsourcing.snapshot.SnapshotStore;
import com.ivamare.eventsourcing.snapshot.SnapshotStrategy;
import com.ivamare.eventsourcing.snapshot.impl.InMemorySnapshotStore;
import com.ivamare.eventsourcing.snapshot.impl.JdbcSnapshotStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;

/**
 * Auto-configuration for event sourcing.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Event store, snapshot store and outbox store (JDBC or in-memory)</li>
 *   <li>Aggregate factory registry</li>
 *   <li>Event bus, subscribed to every event delivered by the outbox</li>
 *   <li>Outbox</li>
 *   <li>Repository</li>
 *   <li>Command dispatcher with logging, metrics and retry-on-conflict middleware</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * eventsourcing.enabled=false
 * </pre>
 */
@AutoConfiguration(after = {
    DataSourceAutoConfiguration.class,
    DataSourceTransactionManagerAutoConfiguration.class,
    JdbcTemplateAutoConfiguration.class
})
@ConditionalOnProperty(prefix = "eventsourcing", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(EventSourcingProperties.class)
public class EventSourcingAutoConfiguration {

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper eventSourcingObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // Register JSR310 module
        return mapper;
    }

    // --- Registries and Policies ---

    @Bean
    @ConditionalOnMissingBean
    public AggregateFactoryRegistry aggregateFactoryRegistry() {
        return new AggregateFactoryRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public SnapshotStrategy snapshotStrategy(EventSourcingProperties properties) {
        return SnapshotStrategy.everyNumberOfEvents(properties.getSnapshot().getEveryNumberOfEvents());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(EventSourcingProperties properties) {
        return new RetryPolicy(
            properties.getCommand().getMaxAttempts(),
            properties.getCommand().getBackoffScheduleMs()
        );
    }

    // --- Event Bus and Outbox ---

    @Bean
    @ConditionalOnMissingBean
    public EventBus eventBus(EventSourcingProperties properties) {
        return new DefaultEventBus(DefaultEventBus.DEFAULT_HANDLER_TYPE, properties.getOutbox().getErrorBufferSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public Outbox outbox(OutboxStore outboxStore, EventBus eventBus, EventSourcingProperties properties) {
        DefaultOutbox outbox = new DefaultOutbox(outboxStore, properties.getOutbox());
        outbox.addHandler(EventMatcher.any(), eventBus);
        return outbox;
    }

    // --- Repository ---

    @Bean
    @ConditionalOnMissingBean
    public Repository repository(
            EventStore eventStore,
            AggregateFactoryRegistry aggregateFactoryRegistry,
            SnapshotStore snapshotStore,
            SnapshotStrategy snapshotStrategy,
            Outbox outbox,
            EventSourcingProperties properties,
            ObjectProvider<PlatformTransactionManager> transactionManager,
            ObjectProvider<MeterRegistry> meterRegistry) {
        // Events and outbox rows commit together
        TransactionTemplate transactionTemplate = null;
        if (properties.getStorage() == EventSourcingProperties.Storage.JDBC) {
            PlatformTransactionManager manager = transactionManager.getIfUnique();
            if (manager != null) {
                transactionTemplate = new TransactionTemplate(manager);
            }
        }

        Repository repository = new EventSourcedRepository(
            eventStore,
            aggregateFactoryRegistry,
            snapshotStore,
            snapshotStrategy,
            outbox,
            transactionTemplate
        );

        MeterRegistry registry = meterRegistry.getIfAvailable();
        return registry != null ? new MeteredRepository(repository, registry) : repository;
    }

    // --- Command Dispatcher ---

    @Bean
    @ConditionalOnMissingBean
    public CommandDispatcher commandDispatcher(RetryPolicy retryPolicy, ObjectProvider<MeterRegistry> meterRegistry) {
        List<CommandHandlerMiddleware> middlewares = new ArrayList<>();
        middlewares.add(new LoggingMiddleware());
        meterRegistry.ifAvailable(registry -> middlewares.add(new MetricsMiddleware(registry)));
        middlewares.add(new RetryOnConflictMiddleware(retryPolicy));
        return new DefaultCommandDispatcher(middlewares);
    }

    /**
     * PostgreSQL storage. Requires the schema in {@code db/eventsourcing/schema.sql}.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "eventsourcing", name = "storage", havingValue = "jdbc", matchIfMissing = true)
    static class JdbcStorageConfiguration {

        @Bean
        @ConditionalOnMissingBean(TransactionManager.class)
        public PlatformTransactionManager eventSourcingTransactionManager(DataSource dataSource) {
            return new DataSourceTransactionManager(dataSource);
        }

        @Bean
        @ConditionalOnMissingBean
        public EventStore eventStore(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager,
                                     ObjectMapper objectMapper) {
            return new JdbcEventStore(jdbcTemplate, new TransactionTemplate(transactionManager), objectMapper);
        }

        @Bean
        @ConditionalOnMissingBean
        public SnapshotStore snapshotStore(JdbcTemplate jdbcTemplate) {
            return new JdbcSnapshotStore(jdbcTemplate);
        }

        @Bean
        @ConditionalOnMissingBean
        public OutboxStore outboxStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcOutboxStore(jdbcTemplate, objectMapper);
        }
    }

    /**
     * In-memory storage for tests and prototypes. Nothing survives a restart.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "eventsourcing", name = "storage", havingValue = "in-memory")
    static class InMemoryStorageConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public EventStore eventStore() {
            return new InMemoryEventStore();
        }

        @Bean
        @ConditionalOnMissingBean
        public SnapshotStore snapshotStore() {
            return new InMemorySnapshotStore();
        }

        @Bean
        @ConditionalOnMissingBean
        public OutboxStore outboxStore() {
            return new InMemoryOutboxStore();
        }
    }
}
