package org.neuralchilli.plexor.executor.container;

/**
 * Pod lifecycle phase, as reported by a {@link PodLauncher}.
 */
public enum PodPhase {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    UNKNOWN;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
