package org.neuralchilli.plexor.executor.queue;

import com.hazelcast.collection.IQueue;
import com.hazelcast.collection.ItemEvent;
import com.hazelcast.collection.ItemListener;
import org.neuralchilli.plexor.domain.StateChange;
import org.neuralchilli.plexor.domain.TaskAttemptId;
import org.neuralchilli.plexor.executor.TaskRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Workers draining one executor's work queue.
 * <p>
 * Threads park on a condition while the queue is empty and are woken by an
 * item listener when work arrives, with a periodic fallback check. Each run
 * reports {@code STARTED}, a {@code HEARTBEAT} every interval, then exactly
 * one terminal change.
 */
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);
    private static final long FALLBACK_WAIT_SECONDS = 5;

    private final String executorName;
    private final IQueue<TaskRun> workQueue;
    private final IQueue<StateChange> events;
    private final CommandRunner commandRunner;
    private final Duration heartbeatInterval;
    private final Clock clock;

    private ExecutorService executorService;
    private ScheduledExecutorService heartbeats;
    private volatile boolean running = false;
    private int workerThreads;
    private UUID queueListenerId;

    // Coordination primitives for event-driven wakeup
    private final Lock wakeLock = new ReentrantLock();
    private final Condition workAvailable = wakeLock.newCondition();
    private final AtomicInteger waitingThreads = new AtomicInteger(0);

    private final Map<TaskAttemptId, Process> processes = new ConcurrentHashMap<>();
    private final Set<TaskAttemptId> claimed = ConcurrentHashMap.newKeySet();
    private final Set<TaskAttemptId> executing = ConcurrentHashMap.newKeySet();
    private final Set<TaskAttemptId> cancelled = ConcurrentHashMap.newKeySet();

    public WorkerPool(
            String executorName,
            IQueue<TaskRun> workQueue,
            IQueue<StateChange> events,
            CommandRunner commandRunner,
            Duration heartbeatInterval,
            Clock clock
    ) {
        this.executorName = executorName;
        this.workQueue = workQueue;
        this.events = events;
        this.commandRunner = commandRunner;
        this.heartbeatInterval = heartbeatInterval;
        this.clock = clock;
    }

    /**
     * Start the pool with the given number of worker threads
     */
    public synchronized void start(int threads) {
        if (running) {
            log.warn("Worker pool {} already running", executorName);
            return;
        }

        this.workerThreads = threads;
        this.running = true;

        log.info("Starting worker pool for {}: {} threads", executorName, workerThreads);

        this.executorService = Executors.newFixedThreadPool(
                workerThreads,
                new WorkerThreadFactory(executorName + "-worker")
        );
        this.heartbeats = Executors.newSingleThreadScheduledExecutor(
                new WorkerThreadFactory(executorName + "-heartbeat")
        );

        registerQueueListener();

        for (int i = 0; i < workerThreads; i++) {
            executorService.submit(this::workerLoop);
        }
    }

    /**
     * Cancel an attempt taken by one of this pool's workers: kill its process,
     * or make sure it is never started if the worker has not launched it yet.
     * Attempts this pool never took are ignored.
     *
     * @return true if the attempt belongs to this pool
     */
    public boolean cancel(TaskAttemptId attemptId) {
        if (!claimed.contains(attemptId)) {
            return false;
        }
        cancelled.add(attemptId);
        // Finished between the check and the add
        if (!claimed.contains(attemptId)) {
            cancelled.remove(attemptId);
            return false;
        }

        Process process = processes.get(attemptId);
        if (process != null) {
            log.info("Killing process of cancelled task {}", attemptId);
            process.destroyForcibly();
        }
        return true;
    }

    private void registerQueueListener() {
        ItemListener<TaskRun> listener = new ItemListener<TaskRun>() {
            @Override
            public void itemAdded(ItemEvent<TaskRun> event) {
                wakeLock.lock();
                try {
                    if (waitingThreads.get() > 0) {
                        workAvailable.signal();
                    }
                } finally {
                    wakeLock.unlock();
                }
            }

            @Override
            public void itemRemoved(ItemEvent<TaskRun> event) {
                // Not needed
            }
        };

        queueListenerId = workQueue.addItemListener(listener, false);
    }

    private void workerLoop() {
        String threadName = Thread.currentThread().getName();
        log.debug("[{}] Worker thread started", threadName);

        while (running) {
            try {
                TaskRun work = workQueue.poll();

                if (work == null) {
                    wakeLock.lock();
                    try {
                        waitingThreads.incrementAndGet();
                        workAvailable.await(FALLBACK_WAIT_SECONDS, TimeUnit.SECONDS);
                        waitingThreads.decrementAndGet();

                        if (!running) {
                            break;
                        }
                    } finally {
                        wakeLock.unlock();
                    }
                    work = workQueue.poll();
                }

                if (work != null) {
                    claimed.add(work.attemptId());
                    try {
                        executeWork(work, threadName);
                    } finally {
                        claimed.remove(work.attemptId());
                        cancelled.remove(work.attemptId());
                    }
                }

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("[{}] Worker thread interrupted, exiting", threadName);
                break;
            } catch (Exception e) {
                log.error("[{}] Error in worker loop", threadName, e);
            }
        }

        log.debug("[{}] Worker thread stopped", threadName);
    }

    private void executeWork(TaskRun work, String threadName) {
        TaskAttemptId attemptId = work.attemptId();

        if (cancelled.remove(attemptId)) {
            log.info("[{}] Skipping cancelled task {}", threadName, attemptId);
            emit(StateChange.cancelled(attemptId, executorName, clock.instant(), "Cancelled before start"));
            return;
        }

        log.info("[{}] Executing: {}", threadName, attemptId);
        Instant start = clock.instant();
        executing.add(attemptId);
        emit(StateChange.started(attemptId, executorName, start));

        ScheduledFuture<?> heartbeat = heartbeats.scheduleAtFixedRate(
                () -> emit(StateChange.heartbeat(attemptId, executorName, clock.instant())),
                heartbeatInterval.toMillis(),
                heartbeatInterval.toMillis(),
                TimeUnit.MILLISECONDS
        );

        try {
            CommandResult result = commandRunner.run(work, process -> {
                processes.put(attemptId, process);
                // Cancel may have arrived between poll and process start
                if (cancelled.contains(attemptId)) {
                    process.destroyForcibly();
                }
            });
            Instant end = clock.instant();
            long durationMs = Duration.between(start, end).toMillis();

            if (cancelled.remove(attemptId)) {
                log.info("[{}] Cancelled: {} ({}ms)", threadName, attemptId, durationMs);
                emit(StateChange.cancelled(attemptId, executorName, end, "Cancelled while running"));
            } else if (result.success()) {
                log.info("[{}] Completed: {} ({}ms)", threadName, attemptId, durationMs);
                emit(StateChange.succeeded(attemptId, executorName, end, result.data()));
            } else {
                log.warn("[{}] Failed: {} - {}", threadName, attemptId, result.error());
                emit(StateChange.failed(attemptId, executorName, end, result.error()));
            }

        } catch (Exception e) {
            log.error("[{}] Exception executing task: {}", threadName, attemptId, e);
            emit(StateChange.failed(attemptId, executorName, clock.instant(), "Exception: " + e.getMessage()));
        } finally {
            heartbeat.cancel(false);
            processes.remove(attemptId);
            executing.remove(attemptId);
        }
    }

    private void emit(StateChange change) {
        if (!events.offer(change)) {
            log.error("Event queue of {} rejected {} for {}", executorName, change.kind(), change.attemptId());
        }
    }

    /**
     * Stop the pool, letting in-flight tasks finish
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        log.info("Stopping worker pool for {}", executorName);
        running = false;

        wakeLock.lock();
        try {
            workAvailable.signalAll();
        } finally {
            wakeLock.unlock();
        }

        if (queueListenerId != null) {
            try {
                workQueue.removeItemListener(queueListenerId);
            } catch (Exception e) {
                log.warn("Error unregistering queue listener", e);
            }
        }

        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(60, TimeUnit.SECONDS)) {
                log.warn("Worker pool {} did not terminate in 60 seconds, forcing shutdown", executorName);
                processes.values().forEach(Process::destroyForcibly);
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
        heartbeats.shutdownNow();

        log.info("Worker pool for {} stopped", executorName);
    }

    int pendingCancellations() {
        return cancelled.size();
    }

    public WorkerPoolStats getStats() {
        return new WorkerPoolStats(
                workerThreads,
                waitingThreads.get(),
                executing.size(),
                running
        );
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);
        private final String prefix;

        WorkerThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setName(prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }

    public record WorkerPoolStats(
            int totalThreads,
            int waitingThreads,
            int executing,
            boolean running
    ) {
        public double utilization() {
            return totalThreads > 0 ? (double) executing / totalThreads : 0.0;
        }
    }
}
