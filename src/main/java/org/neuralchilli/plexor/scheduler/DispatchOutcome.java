package org.neuralchilli.plexor.scheduler;

/**
 * Result of trying to dispatch one task instance.
 */
public enum DispatchOutcome {
    /** Accepted by an executor */
    DISPATCHED,
    /** Another scheduler got there first, or the instance changed */
    CONFLICT,
    /** The attempt could not be handed to any executor and was failed */
    FAILED
}
