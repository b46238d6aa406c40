package org.neuralchilli.plexor.executor;

import org.neuralchilli.plexor.domain.StateChange;
import org.neuralchilli.plexor.routing.ExecutorType;

import java.util.List;

/**
 * A backend that runs task attempts.
 * <p>
 * Implementations must be thread-safe: {@link #poll()} may run on the
 * scheduler loop while other threads submit or cancel.
 */
public interface ExecutorAdapter {

    /**
     * Unique executor name, as referenced by routing rules
     */
    String name();

    ExecutorType type();

    /**
     * Acquire resources and start any embedded workers
     */
    default void start() {
    }

    /**
     * Hand a task run to the backend.
     *
     * @return a handle identifying the accepted work
     * @throws SubmissionException if the backend rejected the run
     */
    AssignmentHandle submit(TaskRun run) throws SubmissionException;

    /**
     * Drain the state changes observed since the previous poll
     */
    List<StateChange> poll();

    /**
     * Ask the backend to stop the work behind the handle.
     * A {@code CANCELLED} change is reported through {@link #poll()}.
     */
    void cancel(AssignmentHandle handle);

    /**
     * Release resources
     */
    default void stop() {
    }

    /**
     * Number of accepted runs that have not finished yet
     */
    int inFlight();
}
