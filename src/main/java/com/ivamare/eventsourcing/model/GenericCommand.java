package com.ivamare.eventsourcing.model;

import java.util.Map;
import java.util.UUID;

/**
 * A command carrying its payload as a map, as produced by transports.
 *
 * @param aggregateId Identifier of the target aggregate
 * @param aggregateType The type of the target aggregate
 * @param commandType The type of command (e.g., "RenameOrder")
 * @param data The command payload
 */
public record GenericCommand(
    UUID aggregateId,
    String aggregateType,
    String commandType,
    Map<String, Object> data
) implements Command {

    public GenericCommand {
        if (aggregateType == null || aggregateType.isBlank()) {
            throw new IllegalArgumentException("aggregateType is required");
        }
        if (commandType == null || commandType.isBlank()) {
            throw new IllegalArgumentException("commandType is required");
        }
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    /**
     * Create a command without payload.
     */
    public static GenericCommand of(UUID aggregateId, String aggregateType, String commandType) {
        return new GenericCommand(aggregateId, aggregateType, commandType, Map.of());
    }
}
