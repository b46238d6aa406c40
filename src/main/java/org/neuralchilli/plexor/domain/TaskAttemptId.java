package org.neuralchilli.plexor.domain;

import java.io.Serializable;
import java.util.UUID;

/**
 * Identity of a single task instance attempt: (run id, task id, attempt).
 */
public record TaskAttemptId(
        UUID runId,
        String taskId,
        int attempt
) implements Serializable {

    public TaskAttemptId {
        if (runId == null) {
            throw new IllegalArgumentException("Run ID cannot be null");
        }
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("Task ID cannot be null or empty");
        }
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt must be >= 1");
        }
    }

    public TaskInstanceKey key() {
        return new TaskInstanceKey(runId, taskId);
    }

    @Override
    public String toString() {
        return runId + "/" + taskId + "#" + attempt;
    }
}
