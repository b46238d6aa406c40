package org.neuralchilli.plexor.executor.queue;

import java.util.Map;

/**
 * Outcome of running a task command.
 */
public record CommandResult(
        boolean success,
        Map<String, Object> data,
        String error,
        int exitCode
) {

    public CommandResult {
        if (data == null) {
            data = Map.of();
        }
    }

    public static CommandResult success(Map<String, Object> data) {
        return new CommandResult(true, data, null, 0);
    }

    public static CommandResult failure(String error) {
        return new CommandResult(false, Map.of(), error, -1);
    }

    public static CommandResult failure(String error, int exitCode) {
        return new CommandResult(false, Map.of(), error, exitCode);
    }
}
