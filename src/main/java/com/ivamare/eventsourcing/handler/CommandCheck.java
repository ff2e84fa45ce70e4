package com.ivamare.eventsourcing.handler;

import com.ivamare.eventsourcing.exception.MissingAggregateIdException;
import com.ivamare.eventsourcing.model.Command;

import java.util.UUID;

/**
 * Validation every command passes before it reaches an aggregate.
 */
public final class CommandCheck {

    private static final UUID NIL = new UUID(0L, 0L);

    private CommandCheck() {
    }

    /**
     * @throws MissingAggregateIdException if the command or its aggregate id is missing
     */
    public static void check(Command command) {
        if (command == null) {
            throw new MissingAggregateIdException(null);
        }
        UUID id = command.aggregateId();
        if (id == null || NIL.equals(id)) {
            throw new MissingAggregateIdException(command.commandType());
        }
    }
}
