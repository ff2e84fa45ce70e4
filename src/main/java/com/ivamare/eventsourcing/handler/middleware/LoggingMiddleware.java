package com.ivamare.eventsourcing.handler.middleware;

import com.ivamare.eventsourcing.exception.ConcurrencyConflictException;
import com.ivamare.eventsourcing.handler.CommandHandler;
import com.ivamare.eventsourcing.handler.CommandHandlerMiddleware;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs each command with its outcome and duration.
 */
public class LoggingMiddleware implements CommandHandlerMiddleware {

    private static final Logger log = LoggerFactory.getLogger(LoggingMiddleware.class);

    @Override
    public CommandHandler apply(CommandHandler next) {
        return (context, command) -> {
            long start = System.nanoTime();
            log.debug("Handling {} for {} {}", command.commandType(), command.aggregateType(), command.aggregateId());
            try {
                next.handleCommand(context, command);
                log.debug("Handled {} for {} {} in {}ms", command.commandType(), command.aggregateType(),
                    command.aggregateId(), (System.nanoTime() - start) / 1_000_000);
            } catch (ConcurrencyConflictException e) {
                log.info("Concurrency conflict handling {} for {} {}: {}",
                    command.commandType(), command.aggregateType(), command.aggregateId(), e.getMessage());
                throw e;
            } catch (Exception e) {
                log.warn("Failed to handle {} for {} {}: {}",
                    command.commandType(), command.aggregateType(), command.aggregateId(), e.getMessage());
                throw e;
            }
        };
    }
}
