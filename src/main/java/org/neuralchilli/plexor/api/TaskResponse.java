package org.neuralchilli.plexor.api;

import org.neuralchilli.plexor.domain.TaskInstance;
import org.neuralchilli.plexor.domain.TaskState;

import java.time.Instant;
import java.util.Map;

public record TaskResponse(
        String task,
        int attempt,
        TaskState state,
        String queue,
        String executor,
        Instant queuedAt,
        Instant startedAt,
        Instant endedAt,
        Instant nextRetryAt,
        String error,
        Map<String, Object> result,
        boolean cancelRequested
) {
    public static TaskResponse from(TaskInstance instance) {
        return new TaskResponse(
                instance.taskId(),
                instance.attempt(),
                instance.state(),
                instance.queue(),
                instance.executor(),
                instance.queuedAt(),
                instance.startedAt(),
                instance.endedAt(),
                instance.nextRetryAt(),
                instance.error(),
                instance.result(),
                instance.cancelRequested()
        );
    }
}
