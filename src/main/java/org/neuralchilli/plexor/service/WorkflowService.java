package org.neuralchilli.plexor.service;

import io.vertx.mutiny.core.eventbus.EventBus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.plexor.domain.TaskDefinition;
import org.neuralchilli.plexor.domain.TaskInstance;
import org.neuralchilli.plexor.domain.TaskInstanceKey;
import org.neuralchilli.plexor.domain.Workflow;
import org.neuralchilli.plexor.domain.WorkflowRun;
import org.neuralchilli.plexor.reconcile.StateReconciler;
import org.neuralchilli.plexor.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Operations on workflows and their runs: trigger, inspect, cancel, pause
 * and resume. The scheduler loop picks up every change through the store.
 */
@ApplicationScoped
public class WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowService.class);

    private final StateStore store;
    private final EventBus eventBus;
    private final Clock clock;

    @Inject
    public WorkflowService(StateStore store, EventBus eventBus) {
        this(store, eventBus, Clock.systemUTC());
    }

    public WorkflowService(StateStore store, EventBus eventBus, Clock clock) {
        this.store = store;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public Collection<Workflow> workflows() {
        return store.workflows();
    }

    public Workflow getWorkflow(String name) {
        return store.findWorkflow(name)
                .orElseThrow(() -> new ResourceNotFoundException("Workflow not found: " + name));
    }

    /**
     * Start a new run of a workflow. Every task starts {@code PENDING}.
     *
     * @param params overrides of the workflow's default parameters; null values are dropped
     */
    public WorkflowRun trigger(String workflowName, Map<String, Object> params, String triggeredBy) {
        Workflow workflow = getWorkflow(workflowName);

        Map<String, Object> runParams = new LinkedHashMap<>();
        if (params != null) {
            params.forEach((key, value) -> {
                if (value != null) {
                    runParams.put(key, value);
                }
            });
        }

        WorkflowRun run = WorkflowRun.create(workflow.name(), runParams, triggeredBy, clock.instant());
        List<TaskInstance> instances = new ArrayList<>(workflow.tasks().size());
        for (TaskDefinition task : workflow.tasks()) {
            instances.add(TaskInstance.create(run.id(), task));
        }

        store.createRun(run, instances);
        log.info("Triggered run {} of workflow {} ({} tasks, by {})",
                run.id(), workflow.name(), instances.size(), triggeredBy);

        notifyRunChanged(run.id());
        return run;
    }

    public Optional<WorkflowRun> findRun(UUID runId) {
        return store.findRun(runId);
    }

    public WorkflowRun getRun(UUID runId) {
        return findRun(runId).orElseThrow(() -> new ResourceNotFoundException("Run not found: " + runId));
    }

    public Collection<WorkflowRun> activeRuns() {
        return store.activeRuns();
    }

    /**
     * Current instance of every task of a run, in declaration order
     */
    public List<TaskInstance> tasksOf(UUID runId) {
        getRun(runId);
        return store.instancesOf(runId);
    }

    /**
     * Finished attempts of one task, oldest first
     */
    public List<TaskInstance> attemptHistory(UUID runId, String taskId) {
        TaskInstanceKey key = TaskInstanceKey.of(runId, taskId);
        if (store.findInstance(key).isEmpty()) {
            throw new ResourceNotFoundException("Task not found: " + key);
        }
        return store.attemptHistory(key);
    }

    /**
     * Request cancellation of every unfinished task of a run.
     *
     * @return number of tasks newly flagged
     * @throws ConflictException if the run already finished
     */
    public int cancelRun(UUID runId) {
        WorkflowRun run = getRun(runId);
        if (run.isFinished()) {
            throw new ConflictException("Run " + runId + " already finished: " + run.status());
        }

        int flagged = 0;
        for (TaskInstance instance : store.instancesOf(runId)) {
            if (requestCancel(instance.key())) {
                flagged++;
            }
        }

        log.info("Cancellation requested for run {} ({} tasks)", runId, flagged);
        notifyRunChanged(runId);
        return flagged;
    }

    /**
     * Request cancellation of one task
     *
     * @throws ConflictException if the task already finished
     */
    public TaskInstance cancelTask(UUID runId, String taskId) {
        TaskInstanceKey key = TaskInstanceKey.of(runId, taskId);
        TaskInstance instance = store.findInstance(key)
                .orElseThrow(() -> new ResourceNotFoundException("Task not found: " + key));
        if (instance.isFinished()) {
            throw new ConflictException("Task " + key + " already finished: " + instance.state());
        }

        requestCancel(key);
        log.info("Cancellation requested for task {}", key);
        notifyRunChanged(runId);
        return store.findInstance(key).orElse(instance);
    }

    /**
     * Stop dispatching new tasks of a run. Running tasks carry on.
     *
     * @throws ConflictException if the run is not running
     */
    public WorkflowRun pauseRun(UUID runId) {
        WorkflowRun paused = transition(runId, WorkflowRun::pause);
        log.info("Paused run {}", runId);
        return paused;
    }

    /**
     * @throws ConflictException if the run is not paused
     */
    public WorkflowRun resumeRun(UUID runId) {
        WorkflowRun resumed = transition(runId, WorkflowRun::resume);
        log.info("Resumed run {}", runId);
        notifyRunChanged(runId);
        return resumed;
    }

    private WorkflowRun transition(UUID runId, UnaryOperator<WorkflowRun> change) {
        getRun(runId);
        try {
            return store.updateRun(runId, change)
                    .orElseThrow(() -> new ResourceNotFoundException("Run not found: " + runId));
        } catch (IllegalStateException e) {
            throw new ConflictException(e.getMessage(), e);
        }
    }

    private boolean requestCancel(TaskInstanceKey key) {
        TaskInstance before = store.findInstance(key).orElse(null);
        if (before == null || before.isFinished() || before.cancelRequested()) {
            return false;
        }
        store.update(key, inst -> inst.isFinished() || inst.cancelRequested() ? inst : inst.requestCancel());
        return true;
    }

    private void notifyRunChanged(UUID runId) {
        eventBus.publish(StateReconciler.RUN_CHANGED, runId.toString());
    }
}
