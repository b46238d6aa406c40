package org.neuralchilli.plexor.routing;

/**
 * Kind of backend an executor runs work on.
 */
public enum ExecutorType {
    /**
     * Distributed work queue drained by workers
     */
    QUEUE,

    /**
     * One container per task attempt
     */
    CONTAINER;

    public static ExecutorType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Executor type cannot be null or empty");
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown executor type: " + value, e);
        }
    }
}
