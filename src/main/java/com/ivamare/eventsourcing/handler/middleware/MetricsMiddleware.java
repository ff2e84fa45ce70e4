package com.ivamare.eventsourcing.handler.middleware;

import com.ivamare.eventsourcing.exception.ConcurrencyConflictException;
import com.ivamare.eventsourcing.handler.CommandHandler;
import com.ivamare.eventsourcing.handler.CommandHandlerMiddleware;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Records a {@code eventsourcing.command} timer per command type and outcome.
 */
public class MetricsMiddleware implements CommandHandlerMiddleware {

    static final String COMMAND_TIMER = "eventsourcing.command";

    private final MeterRegistry meterRegistry;

    public MetricsMiddleware(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public CommandHandler apply(CommandHandler next) {
        return (context, command) -> {
            Timer.Sample sample = Timer.start(meterRegistry);
            String outcome = "error";
            try {
                next.handleCommand(context, command);
                outcome = "success";
            } catch (ConcurrencyConflictException e) {
                outcome = "conflict";
                throw e;
            } finally {
                sample.stop(meterRegistry.timer(COMMAND_TIMER,
                    "command_type", command.commandType(), "outcome", outcome));
            }
        };
    }
}
