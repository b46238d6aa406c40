package org.neuralchilli.plexor.domain;

/**
 * Lifecycle status of a workflow run.
 */
public enum RunStatus {
    /**
     * Tasks are being dispatched and executed
     */
    RUNNING,

    /**
     * Manually paused, nothing new is dispatched
     */
    PAUSED,

    /**
     * Every task finished successfully or was skipped
     */
    SUCCESS,

    /**
     * One or more tasks failed permanently
     */
    FAILED,

    /**
     * Cancelled on request
     */
    CANCELLED;

    /**
     * Check if this is a terminal status
     */
    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if the run can be resumed
     */
    public boolean canResume() {
        return this == PAUSED;
    }
}
