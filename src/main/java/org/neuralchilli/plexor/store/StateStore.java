package org.neuralchilli.plexor.store;

import org.neuralchilli.plexor.domain.ExecutorAssignment;
import org.neuralchilli.plexor.domain.TaskInstance;
import org.neuralchilli.plexor.domain.TaskInstanceKey;
import org.neuralchilli.plexor.domain.Workflow;
import org.neuralchilli.plexor.domain.WorkflowRun;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Shared scheduler state: workflow definitions, runs, task instances,
 * attempt history and executor assignments.
 * <p>
 * Writes are optimistic. {@code compareAndSet} succeeds only if the stored
 * value still equals the expected one; {@code update} re-reads and re-applies
 * its function a bounded number of times before giving up with
 * {@link org.neuralchilli.plexor.exception.StaleStateException}. A function
 * that returns its argument unchanged writes nothing.
 */
public interface StateStore {

    // Workflow definitions

    void saveWorkflow(Workflow workflow);

    Optional<Workflow> findWorkflow(String name);

    Collection<Workflow> workflows();

    void removeWorkflow(String name);

    // Runs

    /**
     * Store a new run together with its initial task instances
     */
    void createRun(WorkflowRun run, List<TaskInstance> instances);

    Optional<WorkflowRun> findRun(UUID runId);

    /**
     * Runs that are still running or paused
     */
    Collection<WorkflowRun> activeRuns();

    boolean compareAndSetRun(WorkflowRun expected, WorkflowRun next);

    Optional<WorkflowRun> updateRun(UUID runId, UnaryOperator<WorkflowRun> fn);

    // Task instances

    Optional<TaskInstance> findInstance(TaskInstanceKey key);

    List<TaskInstance> instancesOf(UUID runId);

    boolean compareAndSet(TaskInstance expected, TaskInstance next);

    Optional<TaskInstance> update(TaskInstanceKey key, UnaryOperator<TaskInstance> fn);

    // Attempt history

    /**
     * Record a finished attempt
     */
    void archiveAttempt(TaskInstance attempt);

    /**
     * Finished attempts of a task, oldest first
     */
    List<TaskInstance> attemptHistory(TaskInstanceKey key);

    // Executor assignments

    /**
     * Atomically claim the assignment slot of a task instance.
     *
     * @return false if another assignment already occupies the slot
     */
    boolean claimAssignment(ExecutorAssignment assignment);

    Optional<ExecutorAssignment> findAssignment(TaskInstanceKey key);

    boolean replaceAssignment(ExecutorAssignment expected, ExecutorAssignment next);

    /**
     * Remove the assignment only if it is still the given value.
     *
     * @return true for exactly one caller per assignment
     */
    boolean releaseAssignment(ExecutorAssignment assignment);

    Collection<ExecutorAssignment> liveAssignments();
}
