package com.ivamare.eventsourcing.handler;

import com.ivamare.eventsourcing.fixtures.TestEvents;
import com.ivamare.eventsourcing.model.HandlerContext;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class MiddlewaresTest {

    private final List<String> calls = new ArrayList<>();

    private CommandHandlerMiddleware recording(String name) {
        return next -> (context, command) -> {
            calls.add(name + ":before");
            next.handleCommand(context, command);
            calls.add(name + ":after");
        };
    }

    @Test
    void firstMiddlewareShouldBeOutermost() throws Exception {
        CommandHandler handler = Middlewares.useCommandHandlerMiddleware(
            (context, command) -> calls.add("handler"),
            recording("a"), recording("b"));

        handler.handleCommand(HandlerContext.empty(), TestEvents.command("Increment", UUID.randomUUID()));

        assertEquals(List.of("a:before", "b:before", "handler", "b:after", "a:after"), calls);
    }

    @Test
    void noMiddlewaresShouldReturnHandler() {
        CommandHandler handler = (context, command) -> { };

        assertSame(handler, Middlewares.useCommandHandlerMiddleware(handler, List.of()));
    }

    @Test
    void eventMiddlewareShouldWrapInOrder() throws Exception {
        EventHandlerMiddleware tagging = next -> EventHandler.of(next.handlerType(), (context, event) -> {
            calls.add("mw");
            next.handleEvent(context, event);
        });

        EventHandler handler = Middlewares.useEventHandlerMiddleware(
            EventHandler.of("projector", (context, event) -> calls.add("handler")), tagging);

        handler.handleEvent(HandlerContext.empty(), TestEvents.event("Created", UUID.randomUUID(), 1));

        assertEquals("projector", handler.handlerType());
        assertEquals(List.of("mw", "handler"), calls);
    }
}
