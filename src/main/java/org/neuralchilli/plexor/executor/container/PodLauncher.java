package org.neuralchilli.plexor.executor.container;

import java.io.IOException;
import java.util.Optional;

/**
 * Minimal pod API used by the container executor.
 */
public interface PodLauncher {

    /**
     * Create and start a pod.
     *
     * @throws IOException              if the cluster could not be reached
     * @throws IllegalArgumentException if the pod spec was refused
     */
    void launch(PodSpec spec) throws IOException;

    /**
     * Current status of a pod, or empty if it no longer exists
     */
    Optional<PodStatus> status(String podName) throws IOException;

    /**
     * Delete a pod, killing its container. Deleting an unknown pod is a no-op.
     */
    void delete(String podName) throws IOException;

    /**
     * Release the connection to the cluster. Pods already launched keep running.
     */
    default void close() {
    }
}
