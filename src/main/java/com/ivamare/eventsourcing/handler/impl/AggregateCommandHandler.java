package com.ivamare.eventsourcing.handler.impl;

import com.ivamare.eventsourcing.aggregate.Aggregate;
import com.ivamare.eventsourcing.aggregate.AggregateFactoryRegistry;
import com.ivamare.eventsourcing.exception.AggregateNotFoundException;
import com.ivamare.eventsourcing.exception.EventSourcingException;
import com.ivamare.eventsourcing.exception.HandlingException;
import com.ivamare.eventsourcing.exception.InvalidOperationException;
import com.ivamare.eventsourcing.handler.CommandCheck;
import com.ivamare.eventsourcing.handler.CommandHandler;
import com.ivamare.eventsourcing.model.Command;
import com.ivamare.eventsourcing.model.HandlerContext;
import com.ivamare.eventsourcing.repository.Repository;

import java.util.concurrent.CancellationException;

/**
 * Terminal command handler for one aggregate type: load, run domain logic, save.
 *
 * <p>An aggregate without history is created empty, so creating commands go
 * through the same path as updates.
 */
public class AggregateCommandHandler implements CommandHandler {

    private final String aggregateType;
    private final Repository repository;
    private final AggregateFactoryRegistry factoryRegistry;

    public AggregateCommandHandler(String aggregateType, Repository repository,
                                   AggregateFactoryRegistry factoryRegistry) {
        if (aggregateType == null || aggregateType.isBlank()) {
            throw new IllegalArgumentException("aggregateType is required");
        }
        if (!factoryRegistry.isRegistered(aggregateType)) {
            throw new IllegalArgumentException("No aggregate factory registered for " + aggregateType);
        }
        this.aggregateType = aggregateType;
        this.repository = repository;
        this.factoryRegistry = factoryRegistry;
    }

    @Override
    public void handleCommand(HandlerContext context, Command command) {
        CommandCheck.check(command);
        if (command.aggregateType() != null && !aggregateType.equals(command.aggregateType())) {
            throw new InvalidOperationException("Command " + command.commandType()
                + " targets " + command.aggregateType() + " but this handler handles " + aggregateType);
        }
        context.checkActive();

        Aggregate aggregate;
        try {
            aggregate = repository.load(context, aggregateType, command.aggregateId());
        } catch (AggregateNotFoundException e) {
            aggregate = factoryRegistry.create(aggregateType, command.aggregateId());
        }

        try {
            aggregate.handleCommand(context, command);
        } catch (EventSourcingException | CancellationException e) {
            throw e;
        } catch (Exception e) {
            throw new HandlingException("could not handle command " + command.commandType()
                + " for " + aggregateType + " " + command.aggregateId() + ": " + e.getMessage(), e);
        }

        context.checkActive();
        repository.save(context, aggregate);
    }

    public String aggregateType() {
        return aggregateType;
    }
}
