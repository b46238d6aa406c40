package org.neuralchilli.plexor.domain;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;

/**
 * Binds a task instance attempt to the executor that accepted it.
 * At most one assignment exists per {@link TaskInstanceKey}; it is claimed
 * before the instance is queued and removed once the attempt ends.
 */
public record ExecutorAssignment(
        TaskAttemptId attemptId,
        String executor,
        String externalId,
        String schedulerId,
        Instant assignedAt,
        Instant lastHeartbeat,
        boolean cancelSent
) implements Serializable {

    public ExecutorAssignment {
        if (attemptId == null) {
            throw new IllegalArgumentException("Attempt ID cannot be null");
        }
        if (executor == null || executor.isBlank()) {
            throw new IllegalArgumentException("Executor cannot be null or empty");
        }
        if (schedulerId == null || schedulerId.isBlank()) {
            throw new IllegalArgumentException("Scheduler ID cannot be null or empty");
        }
        if (assignedAt == null) {
            throw new IllegalArgumentException("Assigned at cannot be null");
        }
    }

    /**
     * Create a claim for an attempt that has not been submitted yet
     */
    public static ExecutorAssignment claim(
            TaskAttemptId attemptId,
            String executor,
            String schedulerId,
            Instant now
    ) {
        return new ExecutorAssignment(attemptId, executor, null, schedulerId, now, null, false);
    }

    public TaskInstanceKey key() {
        return attemptId.key();
    }

    /**
     * Record the handle the executor returned on submission
     */
    public ExecutorAssignment bind(String handleId, Instant now) {
        return new ExecutorAssignment(attemptId, executor, handleId, schedulerId, assignedAt, now, cancelSent);
    }

    /**
     * Refresh the liveness timestamp
     */
    public ExecutorAssignment heartbeat(Instant now) {
        return new ExecutorAssignment(attemptId, executor, externalId, schedulerId, assignedAt, now, cancelSent);
    }

    /**
     * Remember that the executor was asked to cancel
     */
    public ExecutorAssignment markCancelSent() {
        return new ExecutorAssignment(attemptId, executor, externalId, schedulerId, assignedAt, lastHeartbeat, true);
    }

    public boolean isBound() {
        return externalId != null;
    }

    /**
     * Last sign of life: the latest heartbeat, or the assignment time
     */
    public Instant lastSeen() {
        return lastHeartbeat != null ? lastHeartbeat : assignedAt;
    }

    /**
     * Check if no heartbeat arrived within the timeout
     */
    public boolean isStale(Instant now, Duration timeout) {
        return lastSeen().plus(timeout).isBefore(now);
    }
}
