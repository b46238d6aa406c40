package org.neuralchilli.plexor.executor;

import org.neuralchilli.plexor.domain.StateChange;
import org.neuralchilli.plexor.routing.ExecutorType;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Executor that records what it is given and reports whatever the test emits.
 */
public class FakeExecutorAdapter implements ExecutorAdapter {

    private final String name;
    private final ExecutorType type;
    private final List<TaskRun> submitted = new CopyOnWriteArrayList<>();
    private final List<AssignmentHandle> cancelled = new CopyOnWriteArrayList<>();
    private final Queue<StateChange> changes = new ConcurrentLinkedQueue<>();
    private final Deque<SubmissionException> failures = new ArrayDeque<>();
    private boolean reportCancellations;
    private RuntimeException pollFailure;

    public FakeExecutorAdapter(String name) {
        this(name, ExecutorType.QUEUE);
    }

    public FakeExecutorAdapter(String name, ExecutorType type) {
        this.name = name;
        this.type = type;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ExecutorType type() {
        return type;
    }

    @Override
    public synchronized AssignmentHandle submit(TaskRun run) throws SubmissionException {
        SubmissionException failure = failures.poll();
        if (failure != null) {
            throw failure;
        }
        submitted.add(run);
        return new AssignmentHandle(name, name + "-" + run.attemptId(), run.attemptId(), Instant.EPOCH);
    }

    @Override
    public List<StateChange> poll() {
        if (pollFailure != null) {
            throw pollFailure;
        }
        List<StateChange> drained = new ArrayList<>();
        StateChange change;
        while ((change = changes.poll()) != null) {
            drained.add(change);
        }
        return drained;
    }

    @Override
    public void cancel(AssignmentHandle handle) {
        cancelled.add(handle);
        if (reportCancellations) {
            emit(StateChange.cancelled(handle.attemptId(), name, Instant.EPOCH, "Killed"));
        }
    }

    @Override
    public int inFlight() {
        return submitted.size();
    }

    /**
     * Queue a change for the next poll
     */
    public FakeExecutorAdapter emit(StateChange change) {
        changes.add(change);
        return this;
    }

    /**
     * Make the next submission throw
     */
    public synchronized FakeExecutorAdapter failNextSubmission(SubmissionException failure) {
        failures.add(failure);
        return this;
    }

    public FakeExecutorAdapter reportCancellations() {
        this.reportCancellations = true;
        return this;
    }

    public FakeExecutorAdapter failPolls(RuntimeException failure) {
        this.pollFailure = failure;
        return this;
    }

    public List<TaskRun> submitted() {
        return submitted;
    }

    public TaskRun lastSubmitted() {
        return submitted.get(submitted.size() - 1);
    }

    public List<AssignmentHandle> cancelled() {
        return cancelled;
    }
}
