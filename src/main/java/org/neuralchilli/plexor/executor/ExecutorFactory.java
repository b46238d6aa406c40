package org.neuralchilli.plexor.executor;

import com.hazelcast.core.HazelcastInstance;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.plexor.exception.ConfigurationException;
import org.neuralchilli.plexor.executor.container.ContainerExecutor;
import org.neuralchilli.plexor.executor.container.KubernetesPodLauncher;
import org.neuralchilli.plexor.executor.container.LocalProcessPodLauncher;
import org.neuralchilli.plexor.executor.container.PodLauncher;
import org.neuralchilli.plexor.executor.queue.CommandRunner;
import org.neuralchilli.plexor.executor.queue.QueueWorkerExecutor;
import org.neuralchilli.plexor.routing.ExecutorSpec;

import java.time.Clock;

/**
 * Builds executor adapters from their declared specs.
 */
@ApplicationScoped
public class ExecutorFactory {

    private final HazelcastInstance hazelcast;
    private final CommandRunner commandRunner;
    private final Clock clock = Clock.systemUTC();

    @Inject
    public ExecutorFactory(HazelcastInstance hazelcast, CommandRunner commandRunner) {
        this.hazelcast = hazelcast;
        this.commandRunner = commandRunner;
    }

    public ExecutorAdapter create(ExecutorSpec spec) {
        try {
            return switch (spec.type()) {
                case QUEUE -> new QueueWorkerExecutor(spec, hazelcast, commandRunner, clock);
                case CONTAINER -> new ContainerExecutor(spec, launcherFor(spec), clock);
            };
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid executor " + spec.name() + ": " + e.getMessage(), e);
        }
    }

    /**
     * {@code launcher: local} runs pods as local processes, {@code launcher: kubernetes}
     * talks to the cluster found in the usual kubeconfig or service account.
     */
    PodLauncher launcherFor(ExecutorSpec spec) {
        String launcher = spec.stringOption("launcher", "local");
        return switch (launcher) {
            case "local" -> new LocalProcessPodLauncher(commandRunner, clock);
            case "kubernetes" -> new KubernetesPodLauncher(
                    new KubernetesClientBuilder().build(),
                    spec.stringOption("namespace", ContainerExecutor.DEFAULT_NAMESPACE),
                    commandRunner);
            default -> throw new ConfigurationException(
                    "Executor " + spec.name() + " uses unsupported pod launcher: " + launcher);
        };
    }
}
