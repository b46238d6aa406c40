package org.neuralchilli.plexor.executor;

import org.neuralchilli.plexor.domain.TaskAttemptId;

import java.io.Serial;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A rendered task attempt handed to an executor.
 * Arguments and environment have already been templated.
 */
public final class TaskRun implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final TaskAttemptId attemptId;
    private final String queue;
    private final String command;
    private final List<String> args;
    private final Map<String, String> env;
    private final String image;
    private final long timeoutSeconds;

    public TaskRun(
            TaskAttemptId attemptId,
            String queue,
            String command,
            List<String> args,
            Map<String, String> env,
            String image,
            long timeoutSeconds
    ) {
        if (attemptId == null) {
            throw new IllegalArgumentException("Attempt ID cannot be null");
        }
        if (queue == null || queue.isBlank()) {
            throw new IllegalArgumentException("Queue cannot be null or empty");
        }
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("Command cannot be null or empty");
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("Timeout must be > 0");
        }

        this.attemptId = attemptId;
        this.queue = queue;
        this.command = command;
        this.args = args != null ? List.copyOf(args) : List.of();
        this.env = env != null ? Map.copyOf(env) : Map.of();
        this.image = image;
        this.timeoutSeconds = timeoutSeconds;
    }

    public TaskAttemptId attemptId() {
        return attemptId;
    }

    public String queue() {
        return queue;
    }

    public String command() {
        return command;
    }

    public List<String> args() {
        return args;
    }

    public Map<String, String> env() {
        return env;
    }

    public String image() {
        return image;
    }

    public long timeoutSeconds() {
        return timeoutSeconds;
    }

    /**
     * Command followed by its arguments
     */
    public List<String> commandLine() {
        List<String> line = new ArrayList<>(args.size() + 1);
        line.add(command);
        line.addAll(args);
        return line;
    }

    @Override
    public String toString() {
        return "TaskRun[" +
                "attemptId=" + attemptId +
                ", queue=" + queue +
                ", command=" + command +
                ", args=" + args +
                ", image=" + image +
                ", timeout=" + timeoutSeconds +
                "]";
    }
}
