package org.neuralchilli.plexor.executor;

import org.neuralchilli.plexor.domain.ExecutorAssignment;
import org.neuralchilli.plexor.domain.TaskAttemptId;

import java.io.Serializable;
import java.time.Instant;

/**
 * Reference to work accepted by an executor: a queue message id, a pod name.
 */
public record AssignmentHandle(
        String executor,
        String externalId,
        TaskAttemptId attemptId,
        Instant submittedAt
) implements Serializable {

    public AssignmentHandle {
        if (executor == null || executor.isBlank()) {
            throw new IllegalArgumentException("Executor cannot be null or empty");
        }
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("External ID cannot be null or empty");
        }
        if (attemptId == null) {
            throw new IllegalArgumentException("Attempt ID cannot be null");
        }
    }

    /**
     * Rebuild the handle stored in a bound assignment
     */
    public static AssignmentHandle of(ExecutorAssignment assignment) {
        if (!assignment.isBound()) {
            throw new IllegalStateException("Assignment " + assignment.attemptId() + " has no handle yet");
        }
        return new AssignmentHandle(
                assignment.executor(),
                assignment.externalId(),
                assignment.attemptId(),
                assignment.lastHeartbeat() != null ? assignment.lastHeartbeat() : assignment.assignedAt()
        );
    }
}
