package org.neuralchilli.plexor.scheduler;

import io.vertx.mutiny.core.eventbus.EventBus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.plexor.core.ExpressionContext;
import org.neuralchilli.plexor.core.ExpressionEvaluator;
import org.neuralchilli.plexor.core.ExpressionException;
import org.neuralchilli.plexor.domain.ExecutorAssignment;
import org.neuralchilli.plexor.domain.TaskAttemptId;
import org.neuralchilli.plexor.domain.TaskDefinition;
import org.neuralchilli.plexor.domain.TaskInstance;
import org.neuralchilli.plexor.domain.TaskState;
import org.neuralchilli.plexor.domain.Workflow;
import org.neuralchilli.plexor.domain.WorkflowRun;
import org.neuralchilli.plexor.exception.ConfigurationException;
import org.neuralchilli.plexor.executor.AssignmentHandle;
import org.neuralchilli.plexor.executor.ExecutorAdapter;
import org.neuralchilli.plexor.executor.SubmissionException;
import org.neuralchilli.plexor.executor.SubmissionRetrier;
import org.neuralchilli.plexor.executor.TaskRun;
import org.neuralchilli.plexor.monitoring.SchedulerMetrics;
import org.neuralchilli.plexor.reconcile.StateReconciler;
import org.neuralchilli.plexor.routing.TaskQueueRouter;
import org.neuralchilli.plexor.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Hands ready task instances to executors.
 * <p>
 * The assignment slot is claimed before the instance is moved to
 * {@code QUEUED}, so concurrent schedulers never submit the same instance
 * twice: whoever loses either race backs off without side effects.
 */
@ApplicationScoped
public class TaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(TaskDispatcher.class);
    private static final int MAX_BIND_ATTEMPTS = 5;

    private final StateStore store;
    private final TaskQueueRouter router;
    private final SubmissionRetrier retrier;
    private final ExpressionEvaluator expressionEvaluator;
    private final SchedulerMetrics metrics;
    private final EventBus eventBus;
    private final String schedulerId;

    @Inject
    public TaskDispatcher(
            StateStore store,
            TaskQueueRouter router,
            SubmissionRetrier retrier,
            ExpressionEvaluator expressionEvaluator,
            SchedulerMetrics metrics,
            EventBus eventBus,
            @ConfigProperty(name = "plexor.scheduler.id") Optional<String> schedulerId
    ) {
        this(store, router, retrier, expressionEvaluator, metrics, eventBus,
                schedulerId.orElseGet(() -> "scheduler-" + UUID.randomUUID().toString().substring(0, 8)));
    }

    public TaskDispatcher(
            StateStore store,
            TaskQueueRouter router,
            SubmissionRetrier retrier,
            ExpressionEvaluator expressionEvaluator,
            SchedulerMetrics metrics,
            EventBus eventBus,
            String schedulerId
    ) {
        this.store = store;
        this.router = router;
        this.retrier = retrier;
        this.expressionEvaluator = expressionEvaluator;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.schedulerId = schedulerId;
    }

    public String schedulerId() {
        return schedulerId;
    }

    /**
     * Route, claim, queue, render and submit one ready instance.
     */
    public DispatchOutcome dispatch(WorkflowRun run, Workflow workflow, TaskInstance instance, Instant now) {
        if (!instance.state().isDispatchable()) {
            throw new IllegalArgumentException("Task " + instance.key() + " is not dispatchable in state " + instance.state());
        }

        Optional<TaskDefinition> definition = workflow.task(instance.taskId());
        if (definition.isEmpty()) {
            return failUnqueued(instance, now, "Task " + instance.taskId() + " is no longer defined in " + workflow.name());
        }
        TaskDefinition task = definition.get();

        ExecutorAdapter adapter;
        try {
            adapter = router.route(instance.queue());
        } catch (ConfigurationException e) {
            log.error("Cannot dispatch {}: {}", instance.key(), e.getMessage());
            return failUnqueued(instance, now, e.getMessage());
        }

        int nextAttempt = instance.state() == TaskState.RETRYING ? instance.attempt() + 1 : instance.attempt();
        TaskAttemptId attemptId = new TaskAttemptId(instance.runId(), instance.taskId(), nextAttempt);

        ExecutorAssignment claim = ExecutorAssignment.claim(attemptId, adapter.name(), schedulerId, now);
        if (!store.claimAssignment(claim)) {
            log.debug("Task {} already claimed elsewhere", instance.key());
            metrics.recordDispatchConflict();
            return DispatchOutcome.CONFLICT;
        }

        TaskInstance queued = instance.queue(adapter.name(), now);
        if (!store.compareAndSet(instance, queued)) {
            log.debug("Task {} changed before it could be queued", instance.key());
            store.releaseAssignment(claim);
            metrics.recordDispatchConflict();
            return DispatchOutcome.CONFLICT;
        }

        TaskRun taskRun;
        try {
            taskRun = render(run, workflow, task, queued);
        } catch (ExpressionException | IllegalArgumentException e) {
            return failQueued(queued, now, "Could not render task: " + e.getMessage());
        }

        AssignmentHandle handle;
        SchedulerMetrics.Timer timer = metrics.startTimer("submit");
        try {
            handle = retrier.submit(adapter, taskRun);
        } catch (SubmissionException e) {
            metrics.recordSubmissionFailure();
            return failQueued(queued, now, "Submission failed: " + e.getMessage());
        } finally {
            timer.stop();
        }

        bind(attemptId, handle, now);
        metrics.recordDispatched();
        log.info("Dispatched {} to {} ({})", attemptId, adapter.name(), handle.externalId());
        return DispatchOutcome.DISPATCHED;
    }

    /**
     * Build the run handed to the executor. Run parameters override the
     * workflow defaults; task environment overrides workflow environment.
     */
    TaskRun render(WorkflowRun run, Workflow workflow, TaskDefinition task, TaskInstance queued) {
        Map<String, Object> params = new LinkedHashMap<>(workflow.params());
        params.putAll(run.params());

        Map<String, String> env = new LinkedHashMap<>(workflow.env());
        env.putAll(task.env());

        ExpressionContext context = ExpressionContext.forAttempt(workflow.name(), queued.attemptId(), params, env);

        return new TaskRun(
                queued.attemptId(),
                queued.queue(),
                task.command(),
                expressionEvaluator.evaluateList(task.args(), context),
                expressionEvaluator.evaluateMap(env, context),
                task.image(),
                task.timeoutSeconds()
        );
    }

    private void bind(TaskAttemptId attemptId, AssignmentHandle handle, Instant now) {
        for (int attempt = 0; attempt < MAX_BIND_ATTEMPTS; attempt++) {
            Optional<ExecutorAssignment> current = store.findAssignment(attemptId.key())
                    .filter(assignment -> assignment.attemptId().equals(attemptId));
            if (current.isEmpty()) {
                // Already finished and released by the reconciler
                return;
            }
            if (store.replaceAssignment(current.get(), current.get().bind(handle.externalId(), now))) {
                return;
            }
        }
        log.warn("Could not bind handle {} to {}", handle.externalId(), attemptId);
    }

    private DispatchOutcome failQueued(TaskInstance queued, Instant now, String reason) {
        log.error("Task {} failed at dispatch: {}", queued.attemptId(), reason);

        Optional<TaskInstance> failed = store.update(queued.key(), inst ->
                inst.attempt() == queued.attempt() && inst.state() == TaskState.QUEUED
                        ? inst.fail(reason, now)
                        : inst);

        store.findAssignment(queued.key())
                .filter(assignment -> assignment.attemptId().equals(queued.attemptId()))
                .ifPresent(store::releaseAssignment);

        failed.filter(inst -> inst.state() == TaskState.FAILED && inst.attempt() == queued.attempt())
                .ifPresent(inst -> {
                    store.archiveAttempt(inst);
                    metrics.recordFailed();
                    eventBus.publish(StateReconciler.RUN_CHANGED, inst.runId().toString());
                });
        return DispatchOutcome.FAILED;
    }

    private DispatchOutcome failUnqueued(TaskInstance instance, Instant now, String reason) {
        TaskInstance queued = instance.queue(instance.executor() != null ? instance.executor() : "none", now);
        if (!store.compareAndSet(instance, queued)) {
            metrics.recordDispatchConflict();
            return DispatchOutcome.CONFLICT;
        }
        return failQueued(queued, now, reason);
    }
}
