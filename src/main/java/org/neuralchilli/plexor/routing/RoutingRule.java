package org.neuralchilli.plexor.routing;

/**
 * Maps a queue name, or a queue prefix ending in {@code *}, to an executor.
 */
public record RoutingRule(
        String queuePattern,
        String executor
) {

    public RoutingRule {
        if (queuePattern == null || queuePattern.isBlank()) {
            throw new IllegalArgumentException("Queue pattern cannot be null or empty");
        }
        if (executor == null || executor.isBlank()) {
            throw new IllegalArgumentException("Executor cannot be null or empty");
        }
        int star = queuePattern.indexOf('*');
        if (star >= 0 && star != queuePattern.length() - 1) {
            throw new IllegalArgumentException(
                    "Wildcard is only allowed at the end of a queue pattern, got: " + queuePattern);
        }
    }

    public boolean isPrefix() {
        return queuePattern.endsWith("*");
    }

    /**
     * The literal part of a prefix pattern
     */
    public String prefix() {
        return isPrefix() ? queuePattern.substring(0, queuePattern.length() - 1) : queuePattern;
    }

    public boolean matches(String queue) {
        return isPrefix() ? queue.startsWith(prefix()) : queue.equals(queuePattern);
    }
}
