package org.neuralchilli.plexor.reconcile;

import io.vertx.mutiny.core.eventbus.EventBus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.plexor.domain.ExecutorAssignment;
import org.neuralchilli.plexor.domain.StateChange;
import org.neuralchilli.plexor.domain.TaskAttemptId;
import org.neuralchilli.plexor.domain.TaskInstance;
import org.neuralchilli.plexor.domain.TaskInstanceKey;
import org.neuralchilli.plexor.domain.TaskState;
import org.neuralchilli.plexor.exception.StaleStateException;
import org.neuralchilli.plexor.executor.AssignmentHandle;
import org.neuralchilli.plexor.executor.ExecutorAdapter;
import org.neuralchilli.plexor.monitoring.SchedulerMetrics;
import org.neuralchilli.plexor.routing.ExecutorRegistry;
import org.neuralchilli.plexor.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * Folds executor reports back into canonical task state.
 * <p>
 * Every mutation is a compare-and-set against the shared store, so any
 * number of scheduler processes may reconcile the same executors. Changes
 * for an attempt other than the current one, or for an instance that is no
 * longer queued or running, are ignored.
 */
@ApplicationScoped
public class StateReconciler {

    private static final Logger log = LoggerFactory.getLogger(StateReconciler.class);

    /**
     * Event bus address notified with a run id whenever one of its tasks changes state
     */
    public static final String RUN_CHANGED = "plexor.run.changed";

    private static final int MAX_RELEASE_ATTEMPTS = 5;

    private final StateStore store;
    private final ExecutorRegistry registry;
    private final EventBus eventBus;
    private final SchedulerMetrics metrics;
    private final Duration heartbeatTimeout;

    // Changes that lost too many optimistic lock races, retried next pass
    private final Queue<StateChange> deferred = new ConcurrentLinkedQueue<>();

    @Inject
    public StateReconciler(
            StateStore store,
            ExecutorRegistry registry,
            EventBus eventBus,
            SchedulerMetrics metrics,
            @ConfigProperty(name = "plexor.reconciler.heartbeat-timeout-seconds", defaultValue = "300") long heartbeatTimeoutSeconds
    ) {
        this(store, registry, eventBus, metrics, Duration.ofSeconds(heartbeatTimeoutSeconds));
    }

    public StateReconciler(
            StateStore store,
            ExecutorRegistry registry,
            EventBus eventBus,
            SchedulerMetrics metrics,
            Duration heartbeatTimeout
    ) {
        if (heartbeatTimeout.isNegative() || heartbeatTimeout.isZero()) {
            throw new IllegalArgumentException("Heartbeat timeout must be positive");
        }
        this.store = store;
        this.registry = registry;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.heartbeatTimeout = heartbeatTimeout;
    }

    /**
     * Poll every executor and apply what it reports, then forward pending
     * cancellations and drop orphaned assignments.
     */
    public ReconcileReport reconcile(Instant now) {
        List<StateChange> changes = new ArrayList<>();
        StateChange retry;
        while ((retry = deferred.poll()) != null) {
            changes.add(retry);
        }

        for (ExecutorAdapter adapter : registry.all()) {
            try {
                changes.addAll(adapter.poll());
            } catch (RuntimeException e) {
                log.warn("Polling executor {} failed: {}", adapter.name(), e.getMessage(), e);
            }
        }

        int applied = 0;
        int ignored = 0;
        for (StateChange change : changes) {
            try {
                if (apply(change, now)) {
                    applied++;
                } else {
                    ignored++;
                }
            } catch (StaleStateException e) {
                log.warn("Deferring {} of {}: {}", change.kind(), change.attemptId(), e.getMessage());
                metrics.recordOptimisticLockFailure();
                deferred.add(change);
            }
        }

        int cancellations = propagateCancellations();
        int orphans = detectOrphans(now);

        ReconcileReport report = new ReconcileReport(applied, ignored, cancellations, orphans);
        if (!report.isEmpty()) {
            log.debug("Reconciled: {}", report);
        }
        return report;
    }

    /**
     * Apply one executor report.
     *
     * @return true if the task instance or its assignment changed
     */
    public boolean apply(StateChange change, Instant now) {
        TaskAttemptId attemptId = change.attemptId();
        TaskInstanceKey key = attemptId.key();

        Optional<TaskInstance> found = store.findInstance(key);
        if (found.isEmpty()) {
            log.debug("Ignoring {} for unknown task {}", change.kind(), key);
            return false;
        }

        TaskInstance instance = found.get();
        if (instance.attempt() != attemptId.attempt()) {
            log.debug("Ignoring stale {} for {} (current attempt {})", change.kind(), attemptId, instance.attempt());
            metrics.recordStaleChange();
            return false;
        }
        if (!instance.state().isInFlight()) {
            log.debug("Ignoring {} for {} in state {}", change.kind(), attemptId, instance.state());
            metrics.recordStaleChange();
            return false;
        }

        return switch (change.kind()) {
            case STARTED -> {
                boolean started = transition(attemptId, inst -> inst.state() == TaskState.QUEUED ? inst.start(change.at()) : inst)
                        .isPresent();
                boolean refreshed = refreshHeartbeat(attemptId, now);
                if (started) {
                    log.info("Task {} started on {}", attemptId, change.executor());
                }
                yield started || refreshed;
            }
            case HEARTBEAT -> refreshHeartbeat(attemptId, now);
            case SUCCEEDED -> finish(change, inst -> inst.succeed(change.result(), now));
            case FAILED -> finish(change, inst -> inst.failAttempt(change.message(), now));
            case CANCELLED -> finish(change, inst -> inst.cancel(
                    change.message() != null ? change.message() : "Cancelled", now));
        };
    }

    /**
     * Forward cancel requests to the executors holding the flagged instances.
     * Each assignment is cancelled at most once.
     *
     * @return number of cancel requests sent
     */
    public int propagateCancellations() {
        int sent = 0;
        for (ExecutorAssignment assignment : store.liveAssignments()) {
            if (assignment.cancelSent() || !assignment.isBound()) {
                continue;
            }

            Optional<TaskInstance> instance = store.findInstance(assignment.key());
            if (instance.isEmpty()
                    || !instance.get().cancelRequested()
                    || instance.get().attempt() != assignment.attemptId().attempt()) {
                continue;
            }

            ExecutorAssignment marked = assignment.markCancelSent();
            if (!store.replaceAssignment(assignment, marked)) {
                log.debug("Assignment of {} changed concurrently, cancelling next pass", assignment.attemptId());
                continue;
            }

            Optional<ExecutorAdapter> adapter = registry.find(assignment.executor());
            if (adapter.isEmpty()) {
                log.warn("Cannot cancel {}: executor {} is not registered here",
                        assignment.attemptId(), assignment.executor());
                continue;
            }

            log.info("Cancelling {} on {}", assignment.attemptId(), assignment.executor());
            adapter.get().cancel(AssignmentHandle.of(marked));
            sent++;
        }
        return sent;
    }

    /**
     * Drop assignments that missed their heartbeat and fail the attempt
     * (retrying when the policy allows). The conditional release makes this
     * happen once per assignment however many schedulers run it.
     *
     * @return number of orphans handled by this caller
     */
    public int detectOrphans(Instant now) {
        int orphans = 0;
        for (ExecutorAssignment assignment : store.liveAssignments()) {
            if (!assignment.isStale(now, heartbeatTimeout)) {
                continue;
            }
            if (!store.releaseAssignment(assignment)) {
                continue;
            }

            orphans++;
            metrics.recordOrphan();
            TaskAttemptId attemptId = assignment.attemptId();
            String reason = "Heartbeat timeout: no sign of life from " + assignment.executor()
                    + " since " + assignment.lastSeen();
            log.warn("Orphaned task {}: {}", attemptId, reason);

            try {
                Optional<TaskInstance> failed = transition(attemptId, inst -> inst.failAttempt(reason, now));
                failed.ifPresent(this::onAttemptEnded);
            } catch (StaleStateException e) {
                log.error("Could not mark orphan {} as failed: {}", attemptId, e.getMessage());
                metrics.recordOptimisticLockFailure();
            }

            if (assignment.isBound()) {
                registry.find(assignment.executor())
                        .ifPresent(adapter -> adapter.cancel(AssignmentHandle.of(assignment)));
            }
        }
        return orphans;
    }

    private boolean finish(StateChange change, UnaryOperator<TaskInstance> fn) {
        Optional<TaskInstance> finished = transition(change.attemptId(), fn);
        if (finished.isEmpty()) {
            return false;
        }

        releaseAssignment(change.attemptId());
        onAttemptEnded(finished.get());
        return true;
    }

    /**
     * Remove the assignment of an attempt, re-reading it if a heartbeat
     * replaced it in between.
     */
    private void releaseAssignment(TaskAttemptId attemptId) {
        for (int attempt = 0; attempt < MAX_RELEASE_ATTEMPTS; attempt++) {
            Optional<ExecutorAssignment> assignment = store.findAssignment(attemptId.key())
                    .filter(a -> a.attemptId().equals(attemptId));
            if (assignment.isEmpty() || store.releaseAssignment(assignment.get())) {
                return;
            }
        }
        log.warn("Could not release assignment of {}, leaving it to orphan detection", attemptId);
    }

    /**
     * Apply fn to the instance if it still holds the given attempt in flight.
     *
     * @return the new value, or empty if nothing was written
     */
    private Optional<TaskInstance> transition(TaskAttemptId attemptId, UnaryOperator<TaskInstance> fn) {
        AtomicBoolean changed = new AtomicBoolean(false);
        Optional<TaskInstance> result = store.update(attemptId.key(), inst -> {
            boolean current = inst.attempt() == attemptId.attempt() && inst.state().isInFlight();
            TaskInstance next = current ? fn.apply(inst) : inst;
            changed.set(next != inst);
            return next;
        });
        return changed.get() ? result : Optional.empty();
    }

    private boolean refreshHeartbeat(TaskAttemptId attemptId, Instant now) {
        Optional<ExecutorAssignment> assignment = store.findAssignment(attemptId.key())
                .filter(a -> a.attemptId().equals(attemptId));
        if (assignment.isEmpty()) {
            return false;
        }
        boolean replaced = store.replaceAssignment(assignment.get(), assignment.get().heartbeat(now));
        if (!replaced) {
            log.debug("Heartbeat of {} lost a race, next one will land", attemptId);
        }
        return replaced;
    }

    private void onAttemptEnded(TaskInstance instance) {
        store.archiveAttempt(instance);

        switch (instance.state()) {
            case SUCCESS -> {
                metrics.recordSucceeded();
                log.info("Task {} succeeded", instance.attemptId());
            }
            case RETRYING -> {
                metrics.recordRetried();
                log.warn("Task {} failed, retrying at {}: {}",
                        instance.attemptId(), instance.nextRetryAt(), instance.error());
            }
            case FAILED -> {
                metrics.recordFailed();
                log.error("Task {} failed: {}", instance.attemptId(), instance.error());
            }
            case CANCELLED -> {
                metrics.recordCancelled();
                log.info("Task {} cancelled: {}", instance.attemptId(), instance.error());
            }
            default -> log.debug("Task {} now {}", instance.attemptId(), instance.state());
        }

        notifyRunChanged(instance.runId());
    }

    private void notifyRunChanged(UUID runId) {
        eventBus.publish(RUN_CHANGED, runId.toString());
    }
}
