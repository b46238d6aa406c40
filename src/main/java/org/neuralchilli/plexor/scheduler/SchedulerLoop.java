package org.neuralchilli.plexor.scheduler;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.vertx.ConsumeEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.plexor.domain.TaskInstance;
import org.neuralchilli.plexor.domain.WorkflowRun;
import org.neuralchilli.plexor.exception.StaleStateException;
import org.neuralchilli.plexor.monitoring.SchedulerMetrics;
import org.neuralchilli.plexor.reconcile.ReconcileReport;
import org.neuralchilli.plexor.reconcile.StateReconciler;
import org.neuralchilli.plexor.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The scheduler's main loop: one dedicated thread running
 * {@link #runCycle(Instant)} every interval, or sooner when a run changes.
 * <p>
 * A cycle evaluates every active run, dispatches ready instances (bounded
 * per cycle), reconciles executor reports and closes finished runs. Errors
 * are logged and the loop carries on; it only exits on shutdown.
 */
@ApplicationScoped
public class SchedulerLoop {

    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    private final StateStore store;
    private final RunEvaluator evaluator;
    private final TaskDispatcher dispatcher;
    private final StateReconciler reconciler;
    private final SchedulerMetrics metrics;
    private final boolean enabled;
    private final long intervalMs;
    private final int maxDispatchPerCycle;
    private final Clock clock = Clock.systemUTC();

    private final Lock wakeLock = new ReentrantLock();
    private final Condition wakeUp = wakeLock.newCondition();
    private boolean wakeRequested;

    private Thread thread;
    private volatile boolean running;

    @Inject
    public SchedulerLoop(
            StateStore store,
            RunEvaluator evaluator,
            TaskDispatcher dispatcher,
            StateReconciler reconciler,
            SchedulerMetrics metrics,
            @ConfigProperty(name = "plexor.scheduler.enabled", defaultValue = "true") boolean enabled,
            @ConfigProperty(name = "plexor.scheduler.loop-interval-ms", defaultValue = "1000") long intervalMs,
            @ConfigProperty(name = "plexor.scheduler.max-dispatch-per-cycle", defaultValue = "100") int maxDispatchPerCycle
    ) {
        if (intervalMs < 1) {
            throw new IllegalArgumentException("Loop interval must be >= 1ms");
        }
        if (maxDispatchPerCycle < 1) {
            throw new IllegalArgumentException("Max dispatch per cycle must be >= 1");
        }
        this.store = store;
        this.evaluator = evaluator;
        this.dispatcher = dispatcher;
        this.reconciler = reconciler;
        this.metrics = metrics;
        this.enabled = enabled;
        this.intervalMs = intervalMs;
        this.maxDispatchPerCycle = maxDispatchPerCycle;
    }

    void onStart(@Observes StartupEvent event) {
        if (!enabled) {
            log.info("Scheduler loop is disabled");
            return;
        }
        start();
    }

    void onStop(@Observes ShutdownEvent event) {
        stop();
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        thread = new Thread(this::loop, "plexor-scheduler");
        thread.setDaemon(true);
        thread.start();
        log.info("Scheduler {} started (interval: {}ms, max dispatch per cycle: {})",
                dispatcher.schedulerId(), intervalMs, maxDispatchPerCycle);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        wake();
        try {
            thread.join(TimeUnit.SECONDS.toMillis(10));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Scheduler {} stopped", dispatcher.schedulerId());
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Run the next cycle now instead of waiting for the interval
     */
    @ConsumeEvent(StateReconciler.RUN_CHANGED)
    public void onRunChanged(String runId) {
        log.trace("Run {} changed, waking scheduler", runId);
        wake();
    }

    public void wake() {
        wakeLock.lock();
        try {
            wakeRequested = true;
            wakeUp.signalAll();
        } finally {
            wakeLock.unlock();
        }
    }

    private void loop() {
        while (running) {
            try {
                CycleReport report = runCycle(clock.instant());
                if (!report.isIdle()) {
                    log.debug("Cycle: {}", report);
                }
            } catch (RuntimeException e) {
                metrics.recordCycleError();
                log.error("Scheduler cycle failed", e);
            }

            try {
                awaitNextCycle();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Scheduler thread interrupted, exiting");
                break;
            }
        }
    }

    private void awaitNextCycle() throws InterruptedException {
        wakeLock.lock();
        try {
            if (!wakeRequested && running) {
                wakeUp.await(intervalMs, TimeUnit.MILLISECONDS);
            }
            wakeRequested = false;
        } finally {
            wakeLock.unlock();
        }
    }

    /**
     * One pass over every active run
     */
    public CycleReport runCycle(Instant now) {
        metrics.recordCycle();
        SchedulerMetrics.Timer timer = metrics.startTimer("cycle");

        Collection<WorkflowRun> activeRuns = store.activeRuns();
        int dispatched = 0;
        int conflicts = 0;
        int failures = 0;
        int cancelled = 0;
        int skipped = 0;
        int budget = maxDispatchPerCycle;

        for (WorkflowRun run : activeRuns) {
            try {
                RunEvaluation evaluation = evaluator.evaluate(run, now);
                cancelled += evaluation.cancelled();
                skipped += evaluation.skipped();

                for (TaskInstance instance : evaluation.ready()) {
                    if (budget == 0) {
                        break;
                    }
                    budget--;
                    switch (dispatcher.dispatch(run, evaluation.workflow(), instance, now)) {
                        case DISPATCHED -> dispatched++;
                        case CONFLICT -> conflicts++;
                        case FAILED -> failures++;
                    }
                }
            } catch (StaleStateException e) {
                metrics.recordOptimisticLockFailure();
                log.warn("Run {} is contended, retrying next cycle: {}", run.id(), e.getMessage());
            } catch (RuntimeException e) {
                metrics.recordCycleError();
                log.error("Error evaluating run {}", run.id(), e);
            }
        }

        ReconcileReport reconciled;
        try {
            reconciled = reconciler.reconcile(now);
        } catch (RuntimeException e) {
            metrics.recordCycleError();
            log.error("Reconciliation failed", e);
            reconciled = ReconcileReport.empty();
        }

        int finished = 0;
        for (WorkflowRun run : store.activeRuns()) {
            try {
                if (evaluator.finalizeRun(run, now).isPresent()) {
                    finished++;
                }
            } catch (RuntimeException e) {
                log.error("Error finalizing run {}", run.id(), e);
            }
        }

        timer.stop();
        return new CycleReport(activeRuns.size(), dispatched, conflicts, failures, cancelled, skipped, reconciled, finished);
    }
}
