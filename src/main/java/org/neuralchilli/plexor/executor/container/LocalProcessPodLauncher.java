package org.neuralchilli.plexor.executor.container;

import org.neuralchilli.plexor.executor.ProcessOutput;
import org.neuralchilli.plexor.executor.queue.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs each pod as a local process. The image is only exposed to the
 * process as {@code PLEXOR_IMAGE}; the deadline is enforced on status checks.
 */
public class LocalProcessPodLauncher implements PodLauncher {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessPodLauncher.class);

    private final CommandRunner commandRunner;
    private final Clock clock;
    private final Map<String, LocalPod> pods = new ConcurrentHashMap<>();

    public LocalProcessPodLauncher(CommandRunner commandRunner, Clock clock) {
        this.commandRunner = commandRunner;
        this.clock = clock;
    }

    @Override
    public void launch(PodSpec spec) throws IOException {
        if (pods.containsKey(spec.name())) {
            throw new IllegalArgumentException("Pod already exists: " + spec.name());
        }

        Map<String, String> env = new HashMap<>(spec.env());
        env.put("POD_NAME", spec.name());
        env.put("POD_NAMESPACE", spec.namespace());
        env.put("PLEXOR_IMAGE", spec.image());

        Process process = commandRunner.launch(spec.command(), env);
        ProcessOutput output = ProcessOutput.collect(process, spec.name());
        Instant deadline = clock.instant().plusSeconds(spec.activeDeadlineSeconds());
        pods.put(spec.name(), new LocalPod(process, output, deadline));

        log.debug("Launched local pod {} (pid {})", spec.name(), process.pid());
    }

    @Override
    public Optional<PodStatus> status(String podName) {
        LocalPod pod = pods.get(podName);
        if (pod == null) {
            return Optional.empty();
        }

        if (pod.process.isAlive()) {
            if (clock.instant().isAfter(pod.deadline)) {
                log.warn("Pod {} exceeded its active deadline, killing it", podName);
                pod.deadlineExceeded = true;
                pod.process.destroyForcibly();
                return Optional.of(new PodStatus(podName, PodPhase.FAILED, "DeadlineExceeded", Map.of()));
            }
            return Optional.of(PodStatus.of(podName, PodPhase.RUNNING));
        }

        if (pod.deadlineExceeded) {
            return Optional.of(new PodStatus(podName, PodPhase.FAILED, "DeadlineExceeded", Map.of()));
        }

        // Exited, but the output thread may still be draining
        if (!pod.output.isComplete()) {
            return Optional.of(PodStatus.of(podName, PodPhase.RUNNING));
        }

        int exitCode = pod.process.exitValue();
        String text = pod.output.text();
        if (exitCode == 0) {
            return Optional.of(new PodStatus(podName, PodPhase.SUCCEEDED, null, commandRunner.parseResult(text)));
        }
        return Optional.of(new PodStatus(
                podName, PodPhase.FAILED, "Container exited with code " + exitCode + "\n" + text.trim(), Map.of()));
    }

    @Override
    public void delete(String podName) {
        LocalPod pod = pods.remove(podName);
        if (pod != null && pod.process.isAlive()) {
            pod.process.destroyForcibly();
            log.debug("Deleted local pod {}", podName);
        }
    }

    public int size() {
        return pods.size();
    }

    private static final class LocalPod {
        private final Process process;
        private final ProcessOutput output;
        private final Instant deadline;
        private volatile boolean deadlineExceeded;

        private LocalPod(Process process, ProcessOutput output, Instant deadline) {
            this.process = process;
            this.output = output;
            this.deadline = deadline;
        }
    }
}
