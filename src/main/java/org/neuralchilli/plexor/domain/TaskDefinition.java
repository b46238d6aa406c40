package org.neuralchilli.plexor.domain;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * A task declared inside a workflow.
 */
public record TaskDefinition(
        String name,
        String command,
        List<String> args,
        Map<String, String> env,
        String queue,
        String image,
        int retries,
        long retryDelaySeconds,
        long timeoutSeconds,
        List<String> dependsOn
) implements Serializable {

    public static final String DEFAULT_QUEUE = "default";
    public static final long DEFAULT_RETRY_DELAY_SECONDS = 300;
    public static final long DEFAULT_TIMEOUT_SECONDS = 3600;

    public TaskDefinition {
        // Validation
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task name cannot be null or empty");
        }

        if (!name.matches("^[a-z0-9][a-z0-9_-]*$")) {
            throw new IllegalArgumentException(
                    "Task name must match pattern ^[a-z0-9][a-z0-9_-]*$, got: " + name
            );
        }

        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("Task command cannot be null or empty");
        }

        if (retries < 0) {
            throw new IllegalArgumentException("Task retries must be >= 0, got: " + retries);
        }

        // Defaults
        args = args != null ? List.copyOf(args) : List.of();
        env = env != null ? Map.copyOf(env) : Map.of();
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
        if (queue == null || queue.isBlank()) {
            queue = DEFAULT_QUEUE;
        }
        if (retryDelaySeconds < 0) {
            retryDelaySeconds = DEFAULT_RETRY_DELAY_SECONDS;
        }
        if (timeoutSeconds <= 0) {
            timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        }
    }

    /**
     * Builder for creating tasks fluently
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private String command;
        private List<String> args = List.of();
        private Map<String, String> env = Map.of();
        private String queue = DEFAULT_QUEUE;
        private String image;
        private int retries = 0;
        private long retryDelaySeconds = DEFAULT_RETRY_DELAY_SECONDS;
        private long timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        private List<String> dependsOn = List.of();

        public Builder(String name) {
            this.name = name;
        }

        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder args(List<String> args) {
            this.args = args;
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = env;
            return this;
        }

        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        public Builder image(String image) {
            this.image = image;
            return this;
        }

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder retryDelaySeconds(long retryDelaySeconds) {
            this.retryDelaySeconds = retryDelaySeconds;
            return this;
        }

        public Builder timeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder dependsOn(List<String> dependsOn) {
            this.dependsOn = dependsOn;
            return this;
        }

        public TaskDefinition build() {
            return new TaskDefinition(
                    name, command, args, env, queue, image,
                    retries, retryDelaySeconds, timeoutSeconds, dependsOn
            );
        }
    }
}
