package com.ivamare.eventsourcing.handler.impl;

import com.ivamare.eventsourcing.exception.HandlerAlreadyAddedException;
import com.ivamare.eventsourcing.exception.HandlerNotFoundException;
import com.ivamare.eventsourcing.exception.MissingAggregateIdException;
import com.ivamare.eventsourcing.exception.MissingHandlerException;
import com.ivamare.eventsourcing.fixtures.TestEvents;
import com.ivamare.eventsourcing.handler.CommandHandler;
import com.ivamare.eventsourcing.handler.CommandHandlerMiddleware;
import com.ivamare.eventsourcing.model.Command;
import com.ivamare.eventsourcing.model.HandlerContext;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DefaultCommandDispatcherTest {

    private final HandlerContext ctx = HandlerContext.empty();

    @Test
    void shouldDispatchToRegisteredHandler() throws Exception {
        DefaultCommandDispatcher dispatcher = new DefaultCommandDispatcher();
        List<Command> handled = new ArrayList<>();
        dispatcher.register("Increment", (context, command) -> handled.add(command));
        Command command = TestEvents.command("Increment", UUID.randomUUID());

        dispatcher.dispatch(ctx, command);

        assertEquals(List.of(command), handled);
        assertTrue(dispatcher.hasHandler("Increment"));
        assertEquals(Set.of("Increment"), dispatcher.registeredCommandTypes());
    }

    @Test
    void shouldRejectUnknownCommandType() {
        DefaultCommandDispatcher dispatcher = new DefaultCommandDispatcher();

        assertThrows(HandlerNotFoundException.class,
            () -> dispatcher.dispatch(ctx, TestEvents.command("Increment", UUID.randomUUID())));
    }

    @Test
    void shouldCheckCommandBeforeLookup() {
        DefaultCommandDispatcher dispatcher = new DefaultCommandDispatcher();

        assertThrows(MissingAggregateIdException.class,
            () -> dispatcher.dispatch(ctx, TestEvents.command("Increment", null)));
    }

    @Test
    void shouldRejectDuplicateRegistration() {
        DefaultCommandDispatcher dispatcher = new DefaultCommandDispatcher();
        dispatcher.register("Increment", (context, command) -> { });

        assertThrows(HandlerAlreadyAddedException.class,
            () -> dispatcher.register("Increment", (context, command) -> { }));
        assertThrows(MissingHandlerException.class, () -> dispatcher.register("Rename", null));
    }

    @Test
    void shouldWrapHandlerOnceAtRegistration() throws Exception {
        AtomicInteger wraps = new AtomicInteger();
        AtomicInteger calls = new AtomicInteger();
        CommandHandlerMiddleware counting = next -> {
            wraps.incrementAndGet();
            return (context, command) -> {
                calls.incrementAndGet();
                next.handleCommand(context, command);
            };
        };
        DefaultCommandDispatcher dispatcher = new DefaultCommandDispatcher(List.of(counting));
        CommandHandler noop = (context, command) -> { };
        dispatcher.register("Increment", noop);

        dispatcher.dispatch(ctx, TestEvents.command("Increment", UUID.randomUUID()));
        dispatcher.dispatch(ctx, TestEvents.command("Increment", UUID.randomUUID()));

        assertEquals(1, wraps.get());
        assertEquals(2, calls.get());
    }
}
