package org.neuralchilli.plexor.routing;

import java.util.Map;

/**
 * Declared executor: a name, a type and type-specific options.
 */
public record ExecutorSpec(
        String name,
        ExecutorType type,
        Map<String, Object> options
) {

    public ExecutorSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Executor name cannot be null or empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("Executor type cannot be null");
        }
        options = options != null ? Map.copyOf(options) : Map.of();
    }

    public int intOption(String key, int defaultValue) {
        Object value = options.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Option " + key + " of executor " + name + " must be an integer, got: " + value, e);
        }
    }

    public boolean booleanOption(String key, boolean defaultValue) {
        Object value = options.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    public String stringOption(String key, String defaultValue) {
        Object value = options.get(key);
        return value != null ? value.toString() : defaultValue;
    }
}
