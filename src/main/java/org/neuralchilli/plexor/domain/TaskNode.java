package org.neuralchilli.plexor.domain;

import javax.annotation.Nonnull;
import java.io.Serializable;
import java.util.Objects;

/**
 * Vertex of a workflow DAG. Equality is by task name only.
 */
public record TaskNode(
        String taskName,
        String queue
) implements Serializable {

    public TaskNode {
        if (taskName == null || taskName.isBlank()) {
            throw new IllegalArgumentException("Task name cannot be null or empty");
        }
    }

    public static TaskNode of(TaskDefinition task) {
        return new TaskNode(task.name(), task.queue());
    }

    public static TaskNode named(String taskName) {
        return new TaskNode(taskName, null);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        TaskNode that = (TaskNode) obj;
        return Objects.equals(this.taskName, that.taskName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskName);
    }

    @Nonnull
    @Override
    public String toString() {
        return String.format("TaskNode[%s]", taskName);
    }
}
