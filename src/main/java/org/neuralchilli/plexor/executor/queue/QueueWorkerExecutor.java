package org.neuralchilli.plexor.executor.queue;

import com.hazelcast.collection.IQueue;
import com.hazelcast.collection.ISet;
import com.hazelcast.core.HazelcastException;
import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.topic.ITopic;
import org.neuralchilli.plexor.domain.StateChange;
import org.neuralchilli.plexor.domain.TaskAttemptId;
import org.neuralchilli.plexor.executor.AssignmentHandle;
import org.neuralchilli.plexor.executor.ExecutorAdapter;
import org.neuralchilli.plexor.executor.SubmissionException;
import org.neuralchilli.plexor.executor.TaskRun;
import org.neuralchilli.plexor.routing.ExecutorSpec;
import org.neuralchilli.plexor.routing.ExecutorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Celery-style executor: task runs go onto a distributed work queue drained
 * by workers, which report back through an event queue.
 * <p>
 * Options: {@code workers} (embedded worker threads, 0 for none),
 * {@code capacity} (queued runs before submissions are rejected) and
 * {@code heartbeat-interval-ms}.
 * <p>
 * Queues, in-flight attempts and cancellations live in the Hazelcast cluster,
 * so every scheduler sharing the executor name sees the same executor.
 */
public class QueueWorkerExecutor implements ExecutorAdapter {

    private static final Logger log = LoggerFactory.getLogger(QueueWorkerExecutor.class);
    private static final int MAX_EVENTS_PER_POLL = 1000;

    public static final int DEFAULT_WORKERS = 2;
    public static final int DEFAULT_CAPACITY = 1000;
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 10_000;

    private final String name;
    private final int workers;
    private final int capacity;
    private final Clock clock;

    private final IQueue<TaskRun> workQueue;
    private final IQueue<StateChange> events;
    private final ITopic<TaskAttemptId> cancellations;
    private final WorkerPool workerPool;
    // Shared by every scheduler: terminal events may be drained by a member other than the submitter
    private final ISet<TaskAttemptId> inFlight;

    private UUID cancelListenerId;

    public QueueWorkerExecutor(ExecutorSpec spec, HazelcastInstance hazelcast, CommandRunner commandRunner, Clock clock) {
        if (spec.type() != ExecutorType.QUEUE) {
            throw new IllegalArgumentException("Executor " + spec.name() + " is not a queue executor");
        }
        this.name = spec.name();
        this.workers = spec.intOption("workers", DEFAULT_WORKERS);
        this.capacity = spec.intOption("capacity", DEFAULT_CAPACITY);
        long heartbeatMs = spec.intOption("heartbeat-interval-ms", (int) DEFAULT_HEARTBEAT_INTERVAL_MS);
        if (workers < 0) {
            throw new IllegalArgumentException("Executor " + name + ": workers must be >= 0");
        }
        if (capacity < 1) {
            throw new IllegalArgumentException("Executor " + name + ": capacity must be >= 1");
        }
        if (heartbeatMs < 1) {
            throw new IllegalArgumentException("Executor " + name + ": heartbeat-interval-ms must be >= 1");
        }
        this.clock = clock;

        this.workQueue = hazelcast.getQueue(workQueueName(name));
        this.events = hazelcast.getQueue("plexor-events:" + name);
        this.cancellations = hazelcast.getTopic("plexor-cancel:" + name);
        this.inFlight = hazelcast.getSet("plexor-inflight:" + name);
        this.workerPool = workers > 0
                ? new WorkerPool(name, workQueue, events, commandRunner, Duration.ofMillis(heartbeatMs), clock)
                : null;
    }

    public static String workQueueName(String executorName) {
        return "plexor-work:" + executorName;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ExecutorType type() {
        return ExecutorType.QUEUE;
    }

    @Override
    public void start() {
        cancelListenerId = cancellations.addMessageListener(message -> {
            if (workerPool != null) {
                workerPool.cancel(message.getMessageObject());
            }
        });
        if (workerPool != null) {
            workerPool.start(workers);
        }
        log.info("Queue executor {} started (workers: {}, capacity: {})", name, workers, capacity);
    }

    @Override
    public AssignmentHandle submit(TaskRun run) throws SubmissionException {
        try {
            // Tracked before the offer, so a fast worker cannot report back first
            inFlight.add(run.attemptId());
            if (workQueue.size() >= capacity) {
                throw SubmissionException.transientFailure(
                        "Queue " + workQueueName(name) + " is full (" + capacity + " runs)");
            }
            if (!workQueue.offer(run)) {
                throw SubmissionException.transientFailure("Queue " + workQueueName(name) + " rejected the run");
            }
        } catch (SubmissionException e) {
            inFlight.remove(run.attemptId());
            throw e;
        } catch (HazelcastException e) {
            inFlight.remove(run.attemptId());
            throw SubmissionException.transientFailure("Queue " + workQueueName(name) + " unavailable", e);
        }

        log.debug("Queued {} on {}", run.attemptId(), name);
        return new AssignmentHandle(name, workQueueName(name) + "/" + run.attemptId(), run.attemptId(), clock.instant());
    }

    @Override
    public List<StateChange> poll() {
        List<StateChange> drained = new ArrayList<>();
        events.drainTo(drained, MAX_EVENTS_PER_POLL);
        for (StateChange change : drained) {
            if (change.kind().isTerminal()) {
                inFlight.remove(change.attemptId());
            }
        }
        return drained;
    }

    @Override
    public void cancel(AssignmentHandle handle) {
        TaskAttemptId attemptId = handle.attemptId();

        // Still waiting in the queue: take it out and report directly
        for (TaskRun queued : workQueue) {
            if (queued.attemptId().equals(attemptId) && workQueue.remove(queued)) {
                log.info("Removed cancelled task {} from queue {}", attemptId, name);
                inFlight.remove(attemptId);
                events.offer(StateChange.cancelled(attemptId, name, clock.instant(), "Cancelled while queued"));
                return;
            }
        }

        // Otherwise a worker somewhere has it
        log.info("Broadcasting cancellation of {} to workers of {}", attemptId, name);
        cancellations.publish(attemptId);
    }

    @Override
    public void stop() {
        if (workerPool != null) {
            workerPool.stop();
        }
        if (cancelListenerId != null) {
            cancellations.removeMessageListener(cancelListenerId);
        }
        log.info("Queue executor {} stopped", name);
    }

    @Override
    public int inFlight() {
        return inFlight.size();
    }

    public int queuedRuns() {
        return workQueue.size();
    }

    public WorkerPool.WorkerPoolStats workerStats() {
        return workerPool != null ? workerPool.getStats() : new WorkerPool.WorkerPoolStats(0, 0, 0, false);
    }
}
