package org.neuralchilli.plexor.monitoring;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-process counters for the scheduler of this node.
 *
 * Tracks:
 * - dispatch outcomes (dispatched, conflicts, submission failures)
 * - task outcomes as applied by the reconciler
 * - orphans and ignored stale changes
 * - DAG cache efficiency and optimistic lock exhaustion
 * - timing of cycles and submissions
 */
@ApplicationScoped
public class SchedulerMetrics {

    private static final Logger log = LoggerFactory.getLogger(SchedulerMetrics.class);

    // Loop
    private final LongAdder cycles = new LongAdder();
    private final LongAdder cycleErrors = new LongAdder();

    // Dispatch
    private final LongAdder tasksDispatched = new LongAdder();
    private final LongAdder dispatchConflicts = new LongAdder();
    private final LongAdder submissionFailures = new LongAdder();

    // Task outcomes
    private final LongAdder tasksSucceeded = new LongAdder();
    private final LongAdder tasksFailed = new LongAdder();
    private final LongAdder tasksRetried = new LongAdder();
    private final LongAdder tasksCancelled = new LongAdder();
    private final LongAdder tasksSkipped = new LongAdder();

    // Reconciler
    private final LongAdder orphansDetected = new LongAdder();
    private final LongAdder staleChangesIgnored = new LongAdder();

    // Caching and locking
    private final LongAdder dagCacheHits = new LongAdder();
    private final LongAdder dagCacheMisses = new LongAdder();
    private final LongAdder optimisticLockFailures = new LongAdder();

    private final Map<String, TimingStats> timingStats = new ConcurrentHashMap<>();

    public void recordCycle() {
        cycles.increment();
    }

    public void recordCycleError() {
        cycleErrors.increment();
    }

    public void recordDispatched() {
        tasksDispatched.increment();
    }

    public void recordDispatchConflict() {
        dispatchConflicts.increment();
    }

    public void recordSubmissionFailure() {
        submissionFailures.increment();
    }

    public void recordSucceeded() {
        tasksSucceeded.increment();
    }

    public void recordFailed() {
        tasksFailed.increment();
    }

    public void recordRetried() {
        tasksRetried.increment();
    }

    public void recordCancelled() {
        tasksCancelled.increment();
    }

    public void recordSkipped() {
        tasksSkipped.increment();
    }

    public void recordOrphan() {
        orphansDetected.increment();
    }

    public void recordStaleChange() {
        staleChangesIgnored.increment();
    }

    public void recordDagCacheHit() {
        dagCacheHits.increment();
    }

    public void recordDagCacheMiss() {
        dagCacheMisses.increment();
    }

    public void recordOptimisticLockFailure() {
        optimisticLockFailures.increment();
    }

    /**
     * DAG cache hit rate in percent
     */
    public double getDagCacheHitRate() {
        long hits = dagCacheHits.sum();
        long total = hits + dagCacheMisses.sum();
        return total > 0 ? (hits * 100.0) / total : 0.0;
    }

    /**
     * Share of finished tasks that succeeded, in percent
     */
    public double getTaskSuccessRate() {
        long succeeded = tasksSucceeded.sum();
        long total = succeeded + tasksFailed.sum();
        return total > 0 ? (succeeded * 100.0) / total : 0.0;
    }

    /**
     * Start timing an operation.
     *
     * @return handle that records the elapsed time when stopped
     */
    public Timer startTimer(String operation) {
        return new Timer(operation, Instant.now());
    }

    public class Timer {
        private final String operation;
        private final Instant start;

        private Timer(String operation, Instant start) {
            this.operation = operation;
            this.start = start;
        }

        public void stop() {
            recordTiming(operation, Duration.between(start, Instant.now()));
        }
    }

    void recordTiming(String operation, Duration duration) {
        timingStats.computeIfAbsent(operation, key -> new TimingStats()).record(duration);
    }

    public TimingStats getTimingStats(String operation) {
        return timingStats.getOrDefault(operation, new TimingStats());
    }

    public static class TimingStats {
        private final LongAdder count = new LongAdder();
        private final LongAdder totalNanos = new LongAdder();
        private final AtomicLong minNanos = new AtomicLong(Long.MAX_VALUE);
        private final AtomicLong maxNanos = new AtomicLong(0);

        void record(Duration duration) {
            long nanos = duration.toNanos();
            count.increment();
            totalNanos.add(nanos);
            minNanos.updateAndGet(current -> Math.min(current, nanos));
            maxNanos.updateAndGet(current -> Math.max(current, nanos));
        }

        public long getCount() {
            return count.sum();
        }

        public Duration getAverage() {
            long cnt = count.sum();
            return cnt > 0 ? Duration.ofNanos(totalNanos.sum() / cnt) : Duration.ZERO;
        }

        public Duration getMin() {
            long min = minNanos.get();
            return min < Long.MAX_VALUE ? Duration.ofNanos(min) : Duration.ZERO;
        }

        public Duration getMax() {
            return Duration.ofNanos(maxNanos.get());
        }

        @Override
        public String toString() {
            return String.format(
                    "TimingStats[count=%d, avg=%dms, min=%dms, max=%dms]",
                    getCount(),
                    getAverage().toMillis(),
                    getMin().toMillis(),
                    getMax().toMillis()
            );
        }
    }

    /**
     * Snapshot of every counter
     */
    public MetricsReport getReport() {
        Map<String, Long> averageMillis = new TreeMap<>();
        timingStats.forEach((operation, stats) -> averageMillis.put(operation, stats.getAverage().toMillis()));

        return new MetricsReport(
                cycles.sum(),
                cycleErrors.sum(),
                tasksDispatched.sum(),
                dispatchConflicts.sum(),
                submissionFailures.sum(),
                tasksSucceeded.sum(),
                tasksFailed.sum(),
                tasksRetried.sum(),
                tasksCancelled.sum(),
                tasksSkipped.sum(),
                orphansDetected.sum(),
                staleChangesIgnored.sum(),
                getDagCacheHitRate(),
                optimisticLockFailures.sum(),
                getTaskSuccessRate(),
                averageMillis
        );
    }

    public record MetricsReport(
            long cycles,
            long cycleErrors,
            long tasksDispatched,
            long dispatchConflicts,
            long submissionFailures,
            long tasksSucceeded,
            long tasksFailed,
            long tasksRetried,
            long tasksCancelled,
            long tasksSkipped,
            long orphansDetected,
            long staleChangesIgnored,
            double dagCacheHitRate,
            long optimisticLockFailures,
            double taskSuccessRate,
            Map<String, Long> averageMillis
    ) {
    }

    /**
     * Reset all metrics (useful for testing)
     */
    public void reset() {
        cycles.reset();
        cycleErrors.reset();
        tasksDispatched.reset();
        dispatchConflicts.reset();
        submissionFailures.reset();
        tasksSucceeded.reset();
        tasksFailed.reset();
        tasksRetried.reset();
        tasksCancelled.reset();
        tasksSkipped.reset();
        orphansDetected.reset();
        staleChangesIgnored.reset();
        dagCacheHits.reset();
        dagCacheMisses.reset();
        optimisticLockFailures.reset();
        timingStats.clear();
        log.info("Scheduler metrics reset");
    }
}
