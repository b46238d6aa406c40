package org.neuralchilli.plexor.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A state report from an executor about one attempt.
 */
public record StateChange(
        TaskAttemptId attemptId,
        Kind kind,
        String executor,
        Instant at,
        String message,
        Map<String, Object> result
) implements Serializable {

    public enum Kind {
        STARTED,
        HEARTBEAT,
        SUCCEEDED,
        FAILED,
        CANCELLED;

        /**
         * Check if this change ends the attempt
         */
        public boolean isTerminal() {
            return this == SUCCEEDED || this == FAILED || this == CANCELLED;
        }
    }

    public StateChange {
        if (attemptId == null) {
            throw new IllegalArgumentException("Attempt ID cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Kind cannot be null");
        }
        if (executor == null || executor.isBlank()) {
            throw new IllegalArgumentException("Executor cannot be null or empty");
        }
        if (at == null) {
            throw new IllegalArgumentException("Timestamp cannot be null");
        }
        if (result == null) {
            result = Map.of();
        }
    }

    public static StateChange started(TaskAttemptId attemptId, String executor, Instant at) {
        return new StateChange(attemptId, Kind.STARTED, executor, at, null, Map.of());
    }

    public static StateChange heartbeat(TaskAttemptId attemptId, String executor, Instant at) {
        return new StateChange(attemptId, Kind.HEARTBEAT, executor, at, null, Map.of());
    }

    public static StateChange succeeded(TaskAttemptId attemptId, String executor, Instant at, Map<String, Object> result) {
        return new StateChange(attemptId, Kind.SUCCEEDED, executor, at, null, result);
    }

    public static StateChange failed(TaskAttemptId attemptId, String executor, Instant at, String message) {
        return new StateChange(attemptId, Kind.FAILED, executor, at, message, Map.of());
    }

    public static StateChange cancelled(TaskAttemptId attemptId, String executor, Instant at, String message) {
        return new StateChange(attemptId, Kind.CANCELLED, executor, at, message, Map.of());
    }
}
