package org.neuralchilli.plexor.domain;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Current attempt of one task within one workflow run.
 * Stored in Hazelcast under its {@link TaskInstanceKey}; every transition
 * produces a new value with a bumped {@code version} so writers can
 * compare-and-set against the value they read.
 */
public record TaskInstance(
        UUID runId,
        String taskId,
        int attempt,
        TaskState state,
        String queue,
        int maxRetries,
        long retryDelaySeconds,
        String executor,
        Instant queuedAt,
        Instant startedAt,
        Instant endedAt,
        Instant nextRetryAt,
        String error,
        Map<String, Object> result,
        boolean cancelRequested,
        long version
) implements Serializable {

    public TaskInstance {
        if (runId == null) {
            throw new IllegalArgumentException("Run ID cannot be null");
        }
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("Task ID cannot be null or empty");
        }
        if (state == null) {
            throw new IllegalArgumentException("State cannot be null");
        }
        if (queue == null || queue.isBlank()) {
            throw new IllegalArgumentException("Queue cannot be null or empty");
        }
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt must be >= 1");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries must be >= 0");
        }
        if (retryDelaySeconds < 0) {
            throw new IllegalArgumentException("Retry delay must be >= 0");
        }

        // Defaults
        if (result == null) {
            result = Map.of();
        }
    }

    /**
     * Create the first, pending attempt of a task
     */
    public static TaskInstance create(UUID runId, TaskDefinition task) {
        return builder(runId, task.name())
                .queue(task.queue())
                .maxRetries(task.retries())
                .retryDelaySeconds(task.retryDelaySeconds())
                .build();
    }

    public TaskInstanceKey key() {
        return new TaskInstanceKey(runId, taskId);
    }

    public TaskAttemptId attemptId() {
        return new TaskAttemptId(runId, taskId, attempt);
    }

    /**
     * Hand the instance to an executor. A retrying instance starts its next attempt.
     */
    public TaskInstance queue(String executorName, Instant now) {
        TaskInstance.Builder next = transition(TaskState.QUEUED)
                .executor(executorName)
                .queuedAt(now)
                .startedAt(null)
                .endedAt(null)
                .nextRetryAt(null)
                .error(null)
                .result(Map.of());
        if (state == TaskState.RETRYING) {
            next.attempt(attempt + 1);
        }
        return next.build();
    }

    /**
     * Mark as running
     */
    public TaskInstance start(Instant now) {
        return transition(TaskState.RUNNING)
                .startedAt(now)
                .build();
    }

    /**
     * Mark as succeeded
     */
    public TaskInstance succeed(Map<String, Object> taskResult, Instant now) {
        return transition(TaskState.SUCCESS)
                .startedAt(startedAt != null ? startedAt : now)
                .endedAt(now)
                .result(taskResult)
                .error(null)
                .build();
    }

    /**
     * Mark as failed, waiting for the retry delay
     */
    public TaskInstance failForRetry(String errorMessage, Instant now) {
        return transition(TaskState.RETRYING)
                .endedAt(now)
                .nextRetryAt(now.plusSeconds(retryDelaySeconds))
                .error(errorMessage)
                .build();
    }

    /**
     * Mark as permanently failed
     */
    public TaskInstance fail(String errorMessage, Instant now) {
        return transition(TaskState.FAILED)
                .endedAt(now)
                .error(errorMessage)
                .build();
    }

    /**
     * Fail the current attempt, retrying if the policy allows it
     */
    public TaskInstance failAttempt(String errorMessage, Instant now) {
        return hasRetriesLeft()
                ? failForRetry(errorMessage, now)
                : fail(errorMessage, now);
    }

    /**
     * Mark as skipped
     */
    public TaskInstance skip(String reason, Instant now) {
        return transition(TaskState.SKIPPED)
                .endedAt(now)
                .error(reason)
                .build();
    }

    /**
     * Mark as cancelled
     */
    public TaskInstance cancel(String reason, Instant now) {
        return transition(TaskState.CANCELLED)
                .endedAt(now)
                .error(reason)
                .build();
    }

    /**
     * Flag the instance for cancellation. The state is left to the reconciler.
     */
    public TaskInstance requestCancel() {
        return toBuilder()
                .cancelRequested(true)
                .version(version + 1)
                .build();
    }

    /**
     * Check whether another attempt is allowed after the current one fails
     */
    public boolean hasRetriesLeft() {
        return attempt <= maxRetries;
    }

    /**
     * Check if a retrying instance may be dispatched again
     */
    public boolean isRetryDue(Instant now) {
        return state == TaskState.RETRYING
                && (nextRetryAt == null || !now.isBefore(nextRetryAt));
    }

    public boolean isFinished() {
        return state.isTerminal();
    }

    public Duration getDuration() {
        if (startedAt == null || endedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, endedAt);
    }

    private Builder transition(TaskState target) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException(
                    "Cannot move task " + attemptId() + " from " + state + " to " + target);
        }
        return toBuilder()
                .state(target)
                .version(version + 1);
    }

    public Builder toBuilder() {
        return new Builder(runId, taskId)
                .attempt(attempt)
                .state(state)
                .queue(queue)
                .maxRetries(maxRetries)
                .retryDelaySeconds(retryDelaySeconds)
                .executor(executor)
                .queuedAt(queuedAt)
                .startedAt(startedAt)
                .endedAt(endedAt)
                .nextRetryAt(nextRetryAt)
                .error(error)
                .result(result)
                .cancelRequested(cancelRequested)
                .version(version);
    }

    public static Builder builder(UUID runId, String taskId) {
        return new Builder(runId, taskId);
    }

    public static class Builder {
        private final UUID runId;
        private final String taskId;
        private int attempt = 1;
        private TaskState state = TaskState.PENDING;
        private String queue = TaskDefinition.DEFAULT_QUEUE;
        private int maxRetries = 0;
        private long retryDelaySeconds = TaskDefinition.DEFAULT_RETRY_DELAY_SECONDS;
        private String executor;
        private Instant queuedAt;
        private Instant startedAt;
        private Instant endedAt;
        private Instant nextRetryAt;
        private String error;
        private Map<String, Object> result = Map.of();
        private boolean cancelRequested;
        private long version;

        public Builder(UUID runId, String taskId) {
            this.runId = runId;
            this.taskId = taskId;
        }

        public Builder attempt(int attempt) {
            this.attempt = attempt;
            return this;
        }

        public Builder state(TaskState state) {
            this.state = state;
            return this;
        }

        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelaySeconds(long retryDelaySeconds) {
            this.retryDelaySeconds = retryDelaySeconds;
            return this;
        }

        public Builder executor(String executor) {
            this.executor = executor;
            return this;
        }

        public Builder queuedAt(Instant queuedAt) {
            this.queuedAt = queuedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder endedAt(Instant endedAt) {
            this.endedAt = endedAt;
            return this;
        }

        public Builder nextRetryAt(Instant nextRetryAt) {
            this.nextRetryAt = nextRetryAt;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder result(Map<String, Object> result) {
            this.result = result;
            return this;
        }

        public Builder cancelRequested(boolean cancelRequested) {
            this.cancelRequested = cancelRequested;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public TaskInstance build() {
            return new TaskInstance(
                    runId, taskId, attempt, state, queue, maxRetries, retryDelaySeconds,
                    executor, queuedAt, startedAt, endedAt, nextRetryAt, error, result,
                    cancelRequested, version
            );
        }
    }
}
