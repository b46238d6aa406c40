package org.neuralchilli.plexor.executor.container;

import java.util.Map;

/**
 * Observed state of a pod.
 */
public record PodStatus(
        String name,
        PodPhase phase,
        String message,
        Map<String, Object> result
) {

    public PodStatus {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Pod name cannot be null or empty");
        }
        if (phase == null) {
            throw new IllegalArgumentException("Phase cannot be null");
        }
        if (result == null) {
            result = Map.of();
        }
    }

    public static PodStatus of(String name, PodPhase phase) {
        return new PodStatus(name, phase, null, Map.of());
    }
}
