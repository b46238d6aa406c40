package org.neuralchilli.plexor.executor.container;

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

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Kubernetes-style executor: one pod per task attempt, watched by polling.
 * <p>
 * Options: {@code max-pods} (concurrent pods before submissions are
 * rejected), {@code namespace}, {@code default-image} (for tasks that name
 * no image) and {@code heartbeat-interval-ms}.
 */
public class ContainerExecutor implements ExecutorAdapter {

    private static final Logger log = LoggerFactory.getLogger(ContainerExecutor.class);

    public static final int DEFAULT_MAX_PODS = 10;
    public static final String DEFAULT_NAMESPACE = "plexor";
    private static final String POD_PREFIX = "plexor-";

    private final String name;
    private final int maxPods;
    private final String namespace;
    private final String defaultImage;
    private final Duration heartbeatInterval;
    private final PodLauncher launcher;
    private final Clock clock;

    private final Map<String, TrackedPod> tracked = new ConcurrentHashMap<>();
    private final Queue<StateChange> pending = new ConcurrentLinkedQueue<>();

    public ContainerExecutor(ExecutorSpec spec, PodLauncher launcher, Clock clock) {
        if (spec.type() != ExecutorType.CONTAINER) {
            throw new IllegalArgumentException("Executor " + spec.name() + " is not a container executor");
        }
        this.name = spec.name();
        this.maxPods = spec.intOption("max-pods", DEFAULT_MAX_PODS);
        this.namespace = spec.stringOption("namespace", DEFAULT_NAMESPACE);
        this.defaultImage = spec.stringOption("default-image", null);
        this.heartbeatInterval = Duration.ofMillis(spec.intOption("heartbeat-interval-ms", 10_000));
        if (maxPods < 1) {
            throw new IllegalArgumentException("Executor " + name + ": max-pods must be >= 1");
        }
        this.launcher = launcher;
        this.clock = clock;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ExecutorType type() {
        return ExecutorType.CONTAINER;
    }

    @Override
    public AssignmentHandle submit(TaskRun run) throws SubmissionException {
        String image = run.image() != null && !run.image().isBlank() ? run.image() : defaultImage;
        if (image == null) {
            throw SubmissionException.permanent("Task " + run.attemptId() + " has no image and executor "
                    + name + " has no default-image");
        }
        if (tracked.size() >= maxPods) {
            throw SubmissionException.transientFailure("Executor " + name + " is at its pod limit (" + maxPods + ")");
        }

        String podName = podName(run.attemptId());
        PodSpec spec;
        try {
            spec = new PodSpec(
                    podName,
                    namespace,
                    image,
                    run.commandLine(),
                    run.env(),
                    Map.of(
                            "plexor/run-id", run.attemptId().runId().toString(),
                            "plexor/task-id", run.attemptId().taskId(),
                            "plexor/attempt", String.valueOf(run.attemptId().attempt())
                    ),
                    run.timeoutSeconds()
            );
        } catch (IllegalArgumentException e) {
            throw SubmissionException.permanent("Invalid pod spec for " + run.attemptId() + ": " + e.getMessage(), e);
        }

        Instant now = clock.instant();
        tracked.put(podName, new TrackedPod(run.attemptId()));
        try {
            launcher.launch(spec);
        } catch (IOException e) {
            tracked.remove(podName);
            throw SubmissionException.transientFailure("Could not launch pod " + podName + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            tracked.remove(podName);
            throw SubmissionException.permanent("Pod " + podName + " refused: " + e.getMessage(), e);
        }

        log.debug("Launched pod {} for {}", podName, run.attemptId());
        return new AssignmentHandle(name, podName, run.attemptId(), now);
    }

    @Override
    public List<StateChange> poll() {
        List<StateChange> changes = new ArrayList<>();
        StateChange queued;
        while ((queued = pending.poll()) != null) {
            changes.add(queued);
        }

        for (Map.Entry<String, TrackedPod> entry : tracked.entrySet()) {
            String podName = entry.getKey();
            TrackedPod pod = entry.getValue();

            Optional<PodStatus> status;
            try {
                status = launcher.status(podName);
            } catch (IOException e) {
                log.warn("Could not read status of pod {}: {}", podName, e.getMessage());
                continue;
            }

            Instant now = clock.instant();
            if (status.isEmpty()) {
                if (tracked.remove(podName, pod)) {
                    log.warn("Pod {} of {} vanished", podName, pod.attemptId);
                    changes.add(StateChange.failed(pod.attemptId, name, now, "Pod " + podName + " vanished"));
                }
                continue;
            }

            PodStatus current = status.get();
            switch (current.phase()) {
                case PENDING -> heartbeatIfDue(pod, now, changes);
                // Node lost contact: no heartbeat, so a long silence ends as an orphan
                case UNKNOWN -> log.debug("Pod {} of {} is in an unknown phase", podName, pod.attemptId);
                case RUNNING -> {
                    if (!pod.started) {
                        pod.started = true;
                        pod.lastHeartbeat = now;
                        changes.add(StateChange.started(pod.attemptId, name, now));
                    } else {
                        heartbeatIfDue(pod, now, changes);
                    }
                }
                case SUCCEEDED -> {
                    if (tracked.remove(podName, pod)) {
                        changes.add(StateChange.succeeded(pod.attemptId, name, now, current.result()));
                        deleteQuietly(podName);
                    }
                }
                case FAILED -> {
                    if (tracked.remove(podName, pod)) {
                        String message = current.message() != null ? current.message() : "Pod failed";
                        changes.add(StateChange.failed(pod.attemptId, name, now, message));
                        deleteQuietly(podName);
                    }
                }
            }
        }
        return changes;
    }

    @Override
    public void cancel(AssignmentHandle handle) {
        String podName = handle.externalId();
        tracked.remove(podName);
        try {
            launcher.delete(podName);
        } catch (IOException e) {
            log.warn("Could not delete pod {}: {}", podName, e.getMessage());
        }
        log.info("Deleted pod {} of cancelled task {}", podName, handle.attemptId());
        pending.add(StateChange.cancelled(handle.attemptId(), name, clock.instant(), "Pod deleted"));
    }

    @Override
    public void stop() {
        log.info("Container executor {} stopping, {} pods left running", name, tracked.size());
        launcher.close();
    }

    @Override
    public int inFlight() {
        return tracked.size();
    }

    /**
     * DNS-1123 label for an attempt, at most 63 characters:
     * {@code plexor-<task>-<run id prefix>-<attempt>}.
     */
    public static String podName(TaskAttemptId attemptId) {
        String runPart = attemptId.runId().toString().replace("-", "").substring(0, 12);
        String suffix = "-" + runPart + "-" + attemptId.attempt();

        String task = attemptId.taskId()
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9-]", "-");
        int room = PodSpec.MAX_NAME_LENGTH - POD_PREFIX.length() - suffix.length();
        if (task.length() > room) {
            task = task.substring(0, room);
        }
        task = task.replaceAll("^-+", "").replaceAll("-+$", "");
        if (task.isEmpty()) {
            task = "task";
        }
        return POD_PREFIX + task + suffix;
    }

    private void heartbeatIfDue(TrackedPod pod, Instant now, List<StateChange> changes) {
        if (pod.lastHeartbeat == null || !now.isBefore(pod.lastHeartbeat.plus(heartbeatInterval))) {
            pod.lastHeartbeat = now;
            changes.add(StateChange.heartbeat(pod.attemptId, name, now));
        }
    }

    private void deleteQuietly(String podName) {
        try {
            launcher.delete(podName);
        } catch (IOException e) {
            log.warn("Could not clean up pod {}: {}", podName, e.getMessage());
        }
    }

    private static final class TrackedPod {
        private final TaskAttemptId attemptId;
        private volatile boolean started;
        private volatile Instant lastHeartbeat;

        private TrackedPod(TaskAttemptId attemptId) {
            this.attemptId = attemptId;
        }
    }
}
