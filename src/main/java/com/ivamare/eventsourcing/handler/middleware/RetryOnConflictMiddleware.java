package com.ivamare.eventsourcing.handler.middleware;

import com.ivamare.eventsourcing.exception.ConcurrencyConflictException;
import com.ivamare.eventsourcing.handler.CommandHandler;
import com.ivamare.eventsourcing.handler.CommandHandlerMiddleware;
import com.ivamare.eventsourcing.policy.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;

/**
 * Replays the whole wrapped handler after a concurrency conflict.
 *
 * <p>Each retry reloads the aggregate and redoes the domain logic, since the
 * wrapped handler does both. Only {@link ConcurrencyConflictException} is retried;
 * every other failure propagates unchanged, as does the last conflict once the
 * policy is exhausted.
 */
public class RetryOnConflictMiddleware implements CommandHandlerMiddleware {

    private static final Logger log = LoggerFactory.getLogger(RetryOnConflictMiddleware.class);

    private final RetryPolicy retryPolicy;

    public RetryOnConflictMiddleware(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
    }

    @Override
    public CommandHandler apply(CommandHandler next) {
        return (context, command) -> {
            int attempt = 1;
            while (true) {
                try {
                    next.handleCommand(context, command);
                    return;
                } catch (ConcurrencyConflictException e) {
                    if (!retryPolicy.shouldRetry(attempt)) {
                        log.warn("Giving up on {} for {} after {} attempts: {}",
                            command.commandType(), command.aggregateId(), attempt, e.getMessage());
                        throw e;
                    }
                    long backoffMs = retryPolicy.getBackoffMs(attempt);
                    log.debug("Conflict on {} for {} (attempt {}/{}), retrying in {}ms",
                        command.commandType(), command.aggregateId(), attempt, retryPolicy.maxAttempts(), backoffMs);
                    sleep(backoffMs);
                    context.checkActive();
                    attempt++;
                }
            }
        };
    }

    private void sleep(long ms) {
        if (ms <= 0) {
            return;
        }
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting to retry");
        }
    }
}
