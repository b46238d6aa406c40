package org.neuralchilli.plexor.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a task instance.
 */
public enum TaskState {
    /**
     * Instance created, waiting for upstream tasks
     */
    PENDING,

    /**
     * Handed to an executor, not yet picked up
     */
    QUEUED,

    /**
     * Executor reported the attempt as started
     */
    RUNNING,

    /**
     * Attempt finished successfully
     */
    SUCCESS,

    /**
     * Failed with no retries left
     */
    FAILED,

    /**
     * Failed, waiting for the retry delay before the next attempt
     */
    RETRYING,

    /**
     * Not run because an upstream task failed
     */
    SKIPPED,

    /**
     * Cancelled on request
     */
    CANCELLED;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == SKIPPED || this == CANCELLED;
    }

    /**
     * Check if the instance currently occupies an executor
     */
    public boolean isInFlight() {
        return this == QUEUED || this == RUNNING;
    }

    /**
     * Check if the instance may be handed to an executor
     */
    public boolean isDispatchable() {
        return this == PENDING || this == RETRYING;
    }

    public boolean canTransitionTo(TaskState target) {
        return allowedTargets().contains(target);
    }

    public Set<TaskState> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(QUEUED, SKIPPED, CANCELLED);
            case RETRYING -> EnumSet.of(QUEUED, CANCELLED);
            case QUEUED -> EnumSet.of(RUNNING, SUCCESS, FAILED, RETRYING, CANCELLED);
            case RUNNING -> EnumSet.of(SUCCESS, FAILED, RETRYING, CANCELLED);
            case SUCCESS, FAILED, SKIPPED, CANCELLED -> EnumSet.noneOf(TaskState.class);
        };
    }
}
