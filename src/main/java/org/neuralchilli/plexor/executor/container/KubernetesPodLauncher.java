package org.neuralchilli.plexor.executor.container;

import io.fabric8.kubernetes.api.model.ContainerStateTerminated;
import io.fabric8.kubernetes.api.model.ContainerStatus;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.neuralchilli.plexor.executor.queue.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Runs pods on a Kubernetes cluster through the fabric8 client.
 * <p>
 * Each pod has one container named {@code task}, never restarts and is
 * bounded by {@code activeDeadlineSeconds}. The task result is read from the
 * container's termination message, which falls back to the tail of its log.
 */
public class KubernetesPodLauncher implements PodLauncher {

    private static final Logger log = LoggerFactory.getLogger(KubernetesPodLauncher.class);

    static final String CONTAINER_NAME = "task";

    private final KubernetesClient client;
    private final String namespace;
    private final CommandRunner commandRunner;

    public KubernetesPodLauncher(KubernetesClient client, String namespace, CommandRunner commandRunner) {
        this.client = client;
        this.namespace = namespace;
        this.commandRunner = commandRunner;
    }

    @Override
    public void launch(PodSpec spec) throws IOException {
        List<EnvVar> env = spec.env().entrySet().stream()
                .map(entry -> new EnvVar(entry.getKey(), entry.getValue(), null))
                .toList();

        Pod pod = new PodBuilder()
                .withNewMetadata()
                    .withName(spec.name())
                    .withNamespace(spec.namespace())
                    .withLabels(spec.labels())
                .endMetadata()
                .withNewSpec()
                    .withRestartPolicy("Never")
                    .withActiveDeadlineSeconds(spec.activeDeadlineSeconds())
                    .addNewContainer()
                        .withName(CONTAINER_NAME)
                        .withImage(spec.image())
                        .withCommand(spec.command())
                        .withEnv(env)
                        .withTerminationMessagePolicy("FallbackToLogsOnError")
                    .endContainer()
                .endSpec()
                .build();

        try {
            client.pods().inNamespace(spec.namespace()).resource(pod).create();
        } catch (KubernetesClientException e) {
            if (isRetryable(e)) {
                throw new IOException("Kubernetes API error " + e.getCode() + ": " + e.getMessage(), e);
            }
            throw new IllegalArgumentException(e.getMessage(), e);
        }
        log.debug("Created pod {}/{} with image {}", spec.namespace(), spec.name(), spec.image());
    }

    @Override
    public Optional<PodStatus> status(String podName) throws IOException {
        Pod pod;
        try {
            pod = client.pods().inNamespace(namespace).withName(podName).get();
        } catch (KubernetesClientException e) {
            throw new IOException("Cannot read pod " + podName + ": " + e.getMessage(), e);
        }
        if (pod == null) {
            return Optional.empty();
        }
        return Optional.of(toStatus(podName, pod));
    }

    @Override
    public void delete(String podName) throws IOException {
        try {
            client.pods().inNamespace(namespace).withName(podName).delete();
        } catch (KubernetesClientException e) {
            if (e.getCode() == HttpURLConnection.HTTP_NOT_FOUND) {
                return;
            }
            throw new IOException("Cannot delete pod " + podName + ": " + e.getMessage(), e);
        }
        log.debug("Deleted pod {}/{}", namespace, podName);
    }

    @Override
    public void close() {
        client.close();
    }

    /**
     * Throttling, server errors and connection failures are worth another try;
     * any other client error means the request itself is wrong.
     */
    static boolean isRetryable(KubernetesClientException e) {
        int code = e.getCode();
        if (code == 429) {
            return true;
        }
        return code < 400 || code >= 500;
    }

    private PodStatus toStatus(String podName, Pod pod) {
        if (pod.getStatus() == null || pod.getStatus().getPhase() == null) {
            return PodStatus.of(podName, PodPhase.PENDING);
        }

        PodPhase phase = switch (pod.getStatus().getPhase().toLowerCase(Locale.ROOT)) {
            case "pending" -> PodPhase.PENDING;
            case "running" -> PodPhase.RUNNING;
            case "succeeded" -> PodPhase.SUCCEEDED;
            case "failed" -> PodPhase.FAILED;
            default -> PodPhase.UNKNOWN;
        };

        ContainerStateTerminated terminated = terminatedState(pod);
        String terminationMessage = terminated != null ? terminated.getMessage() : null;

        return switch (phase) {
            case SUCCEEDED -> new PodStatus(podName, phase, null,
                    terminationMessage != null ? commandRunner.parseResult(terminationMessage) : Map.of());
            case FAILED -> new PodStatus(podName, phase, failureMessage(pod, terminated), Map.of());
            default -> PodStatus.of(podName, phase);
        };
    }

    private static ContainerStateTerminated terminatedState(Pod pod) {
        List<ContainerStatus> statuses = pod.getStatus().getContainerStatuses();
        if (statuses == null) {
            return null;
        }
        return statuses.stream()
                .filter(status -> CONTAINER_NAME.equals(status.getName()))
                .filter(status -> status.getState() != null && status.getState().getTerminated() != null)
                .map(status -> status.getState().getTerminated())
                .findFirst()
                .orElse(null);
    }

    private static String failureMessage(Pod pod, ContainerStateTerminated terminated) {
        if (terminated != null) {
            String reason = terminated.getReason() != null ? terminated.getReason() : "Error";
            StringBuilder message = new StringBuilder(reason);
            if (terminated.getExitCode() != null) {
                message.append(" (exit code ").append(terminated.getExitCode()).append(')');
            }
            if (terminated.getMessage() != null && !terminated.getMessage().isBlank()) {
                message.append('\n').append(terminated.getMessage().trim());
            }
            return message.toString();
        }
        if (pod.getStatus().getReason() != null) {
            return pod.getStatus().getReason();
        }
        return "Pod failed";
    }
}
