package com.ivamare.eventsourcing.handler.impl;

import com.ivamare.eventsourcing.exception.HandlerAlreadyAddedException;
import com.ivamare.eventsourcing.exception.HandlerNotFoundException;
import com.ivamare.eventsourcing.exception.MissingHandlerException;
import com.ivamare.eventsourcing.handler.CommandCheck;
import com.ivamare.eventsourcing.handler.CommandDispatcher;
import com.ivamare.eventsourcing.handler.CommandHandler;
import com.ivamare.eventsourcing.handler.CommandHandlerMiddleware;
import com.ivamare.eventsourcing.handler.Middlewares;
import com.ivamare.eventsourcing.model.Command;
import com.ivamare.eventsourcing.model.HandlerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe command dispatcher wrapping every registered handler in the
 * configured middleware chain.
 */
public class DefaultCommandDispatcher implements CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(DefaultCommandDispatcher.class);

    private final Map<String, CommandHandler> handlers = new ConcurrentHashMap<>();
    private final List<CommandHandlerMiddleware> middlewares;

    public DefaultCommandDispatcher() {
        this(List.of());
    }

    public DefaultCommandDispatcher(List<CommandHandlerMiddleware> middlewares) {
        this.middlewares = List.copyOf(middlewares);
    }

    @Override
    public void register(String commandType, CommandHandler handler) {
        if (commandType == null || commandType.isBlank()) {
            throw new IllegalArgumentException("commandType is required");
        }
        if (handler == null) {
            throw new MissingHandlerException();
        }

        CommandHandler wrapped = Middlewares.useCommandHandlerMiddleware(handler, middlewares);
        if (handlers.putIfAbsent(commandType, wrapped) != null) {
            throw new HandlerAlreadyAddedException(commandType);
        }
        log.debug("Registered command handler for {} with {} middlewares", commandType, middlewares.size());
    }

    @Override
    public void dispatch(HandlerContext context, Command command) throws Exception {
        CommandCheck.check(command);
        CommandHandler handler = handlers.get(command.commandType());
        if (handler == null) {
            throw new HandlerNotFoundException(command.commandType());
        }
        handler.handleCommand(context, command);
    }

    @Override
    public boolean hasHandler(String commandType) {
        return handlers.containsKey(commandType);
    }

    @Override
    public Set<String> registeredCommandTypes() {
        return Set.copyOf(handlers.keySet());
    }
}
