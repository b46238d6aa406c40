package org.neuralchilli.plexor.store;

import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.plexor.domain.ExecutorAssignment;
import org.neuralchilli.plexor.domain.TaskAttemptId;
import org.neuralchilli.plexor.domain.TaskInstance;
import org.neuralchilli.plexor.domain.TaskInstanceKey;
import org.neuralchilli.plexor.domain.Workflow;
import org.neuralchilli.plexor.domain.WorkflowRun;
import org.neuralchilli.plexor.exception.StaleStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * {@link StateStore} backed by Hazelcast maps. Every scheduler process in the
 * cluster sees the same maps; all mutation is compare-and-swap.
 */
@ApplicationScoped
public class HazelcastStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(HazelcastStateStore.class);
    static final int MAX_OPTIMISTIC_LOCK_RETRIES = 10;

    private final IMap<String, Workflow> workflows;
    private final IMap<UUID, WorkflowRun> runs;
    private final IMap<UUID, Boolean> activeRunIds;
    private final IMap<UUID, ArrayList<String>> runTasks;
    private final IMap<TaskInstanceKey, TaskInstance> instances;
    private final IMap<TaskAttemptId, TaskInstance> attempts;
    private final IMap<TaskInstanceKey, ExecutorAssignment> assignments;

    @Inject
    public HazelcastStateStore(HazelcastInstance hazelcast) {
        this.workflows = hazelcast.getMap("plexor-workflows");
        this.runs = hazelcast.getMap("plexor-runs");
        this.activeRunIds = hazelcast.getMap("plexor-active-runs");
        this.runTasks = hazelcast.getMap("plexor-run-tasks");
        this.instances = hazelcast.getMap("plexor-task-instances");
        this.attempts = hazelcast.getMap("plexor-attempt-history");
        this.assignments = hazelcast.getMap("plexor-assignments");
    }

    @Override
    public void saveWorkflow(Workflow workflow) {
        workflows.put(workflow.name(), workflow);
    }

    @Override
    public Optional<Workflow> findWorkflow(String name) {
        return Optional.ofNullable(workflows.get(name));
    }

    @Override
    public Collection<Workflow> workflows() {
        return List.copyOf(workflows.values());
    }

    @Override
    public void removeWorkflow(String name) {
        workflows.remove(name);
    }

    @Override
    public void createRun(WorkflowRun run, List<TaskInstance> runInstances) {
        ArrayList<String> taskIds = new ArrayList<>(runInstances.size());
        for (TaskInstance instance : runInstances) {
            if (!instance.runId().equals(run.id())) {
                throw new IllegalArgumentException(
                        "Task instance " + instance.key() + " does not belong to run " + run.id());
            }
            taskIds.add(instance.taskId());
        }

        // Instances first, so a scheduler that sees the run also sees its tasks
        for (TaskInstance instance : runInstances) {
            instances.put(instance.key(), instance);
        }
        runTasks.put(run.id(), taskIds);
        runs.put(run.id(), run);
        if (!run.isFinished()) {
            activeRunIds.put(run.id(), Boolean.TRUE);
        }

        log.debug("Stored run {} with {} task instances", run.id(), taskIds.size());
    }

    @Override
    public Optional<WorkflowRun> findRun(UUID runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    /**
     * Runs that are not finished, read through the active-run index so the
     * cost does not grow with the number of finished runs.
     */
    @Override
    public Collection<WorkflowRun> activeRuns() {
        Set<UUID> ids = activeRunIds.keySet();
        if (ids.isEmpty()) {
            return List.of();
        }

        Map<UUID, WorkflowRun> found = runs.getAll(ids);
        List<WorkflowRun> active = new ArrayList<>(found.size());
        for (UUID id : ids) {
            WorkflowRun run = found.get(id);
            if (run == null || run.isFinished()) {
                // Left behind by a scheduler that stopped between finishing the run and unindexing it
                activeRunIds.remove(id);
            } else {
                active.add(run);
            }
        }
        return active;
    }

    @Override
    public boolean compareAndSetRun(WorkflowRun expected, WorkflowRun next) {
        if (!runs.replace(expected.id(), expected, next)) {
            return false;
        }
        unindexIfFinished(next);
        return true;
    }

    @Override
    public Optional<WorkflowRun> updateRun(UUID runId, UnaryOperator<WorkflowRun> fn) {
        for (int attempt = 0; attempt < MAX_OPTIMISTIC_LOCK_RETRIES; attempt++) {
            WorkflowRun current = runs.get(runId);
            if (current == null) {
                return Optional.empty();
            }

            WorkflowRun next = fn.apply(current);
            if (next == null || next.equals(current)) {
                return Optional.of(current);
            }

            if (runs.replace(runId, current, next)) {
                unindexIfFinished(next);
                return Optional.of(next);
            }

            log.debug("Optimistic lock conflict on run {}, retrying (attempt {})", runId, attempt + 1);
        }

        log.error("Failed to update run {} after {} retries", runId, MAX_OPTIMISTIC_LOCK_RETRIES);
        throw new StaleStateException(runId, MAX_OPTIMISTIC_LOCK_RETRIES);
    }

    private void unindexIfFinished(WorkflowRun run) {
        if (run.isFinished()) {
            activeRunIds.remove(run.id());
        }
    }

    @Override
    public Optional<TaskInstance> findInstance(TaskInstanceKey key) {
        return Optional.ofNullable(instances.get(key));
    }

    @Override
    public List<TaskInstance> instancesOf(UUID runId) {
        List<String> taskIds = runTasks.get(runId);
        if (taskIds == null) {
            return List.of();
        }

        Set<TaskInstanceKey> keys = new LinkedHashSet<>();
        for (String taskId : taskIds) {
            keys.add(new TaskInstanceKey(runId, taskId));
        }

        Map<TaskInstanceKey, TaskInstance> found = instances.getAll(keys);
        List<TaskInstance> ordered = new ArrayList<>(found.size());
        for (TaskInstanceKey key : keys) {
            TaskInstance instance = found.get(key);
            if (instance != null) {
                ordered.add(instance);
            }
        }
        return ordered;
    }

    @Override
    public boolean compareAndSet(TaskInstance expected, TaskInstance next) {
        if (!expected.key().equals(next.key())) {
            throw new IllegalArgumentException(
                    "Cannot replace " + expected.key() + " with " + next.key());
        }
        return instances.replace(expected.key(), expected, next);
    }

    @Override
    public Optional<TaskInstance> update(TaskInstanceKey key, UnaryOperator<TaskInstance> fn) {
        for (int attempt = 0; attempt < MAX_OPTIMISTIC_LOCK_RETRIES; attempt++) {
            TaskInstance current = instances.get(key);
            if (current == null) {
                return Optional.empty();
            }

            TaskInstance next = fn.apply(current);
            if (next == null || next.equals(current)) {
                return Optional.of(current);
            }

            if (instances.replace(key, current, next)) {
                return Optional.of(next);
            }

            log.debug("Optimistic lock conflict on task {}, retrying (attempt {})", key, attempt + 1);
        }

        log.error("Failed to update task {} after {} retries", key, MAX_OPTIMISTIC_LOCK_RETRIES);
        throw new StaleStateException(key, MAX_OPTIMISTIC_LOCK_RETRIES);
    }

    @Override
    public void archiveAttempt(TaskInstance attempt) {
        attempts.put(attempt.attemptId(), attempt);
    }

    @Override
    public List<TaskInstance> attemptHistory(TaskInstanceKey key) {
        List<TaskInstance> history = new ArrayList<>();
        for (int attempt = 1; ; attempt++) {
            TaskInstance archived = attempts.get(new TaskAttemptId(key.runId(), key.taskId(), attempt));
            if (archived == null) {
                return history;
            }
            history.add(archived);
        }
    }

    @Override
    public boolean claimAssignment(ExecutorAssignment assignment) {
        return assignments.putIfAbsent(assignment.key(), assignment) == null;
    }

    @Override
    public Optional<ExecutorAssignment> findAssignment(TaskInstanceKey key) {
        return Optional.ofNullable(assignments.get(key));
    }

    @Override
    public boolean replaceAssignment(ExecutorAssignment expected, ExecutorAssignment next) {
        return assignments.replace(expected.key(), expected, next);
    }

    @Override
    public boolean releaseAssignment(ExecutorAssignment assignment) {
        return assignments.remove(assignment.key(), assignment);
    }

    @Override
    public Collection<ExecutorAssignment> liveAssignments() {
        return List.copyOf(assignments.values());
    }
}
