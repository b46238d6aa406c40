package org.neuralchilli.plexor.domain;

import java.io.Serializable;
import java.util.UUID;

/**
 * Slot of a task within a workflow run. Holds the current attempt
 * and keys the executor assignment map.
 */
public record TaskInstanceKey(
        UUID runId,
        String taskId
) implements Serializable {

    public TaskInstanceKey {
        if (runId == null) {
            throw new IllegalArgumentException("Run ID cannot be null");
        }
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("Task ID cannot be null or empty");
        }
    }

    public static TaskInstanceKey of(UUID runId, String taskId) {
        return new TaskInstanceKey(runId, taskId);
    }

    @Override
    public String toString() {
        return runId + "/" + taskId;
    }
}
