package org.neuralchilli.plexor.domain;

import java.io.Serializable;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A workflow definition: a DAG of tasks with default parameters.
 */
public record Workflow(
        String name,
        String description,
        Map<String, Object> params,
        Map<String, String> env,
        List<TaskDefinition> tasks
) implements Serializable {

    public Workflow {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Workflow name cannot be null or empty");
        }

        if (!name.matches("^[a-z0-9][a-z0-9_-]*$")) {
            throw new IllegalArgumentException(
                    "Workflow name must match pattern ^[a-z0-9][a-z0-9_-]*$, got: " + name
            );
        }

        if (tasks == null || tasks.isEmpty()) {
            throw new IllegalArgumentException("Workflow must have at least one task");
        }

        params = params != null ? Map.copyOf(params) : Map.of();
        env = env != null ? Map.copyOf(env) : Map.of();
        tasks = List.copyOf(tasks);
    }

    /**
     * Get all task names in declaration order
     */
    public List<String> taskNames() {
        return tasks.stream()
                .map(TaskDefinition::name)
                .toList();
    }

    public Optional<TaskDefinition> task(String taskName) {
        return tasks.stream()
                .filter(t -> t.name().equals(taskName))
                .findFirst();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private String description;
        private Map<String, Object> params = Map.of();
        private Map<String, String> env = Map.of();
        private List<TaskDefinition> tasks;

        public Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder params(Map<String, Object> params) {
            this.params = params;
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = env;
            return this;
        }

        public Builder tasks(List<TaskDefinition> tasks) {
            this.tasks = tasks;
            return this;
        }

        public Workflow build() {
            return new Workflow(name, description, params, env, tasks);
        }
    }
}
