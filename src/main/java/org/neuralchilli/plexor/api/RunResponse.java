package org.neuralchilli.plexor.api;

import org.neuralchilli.plexor.domain.RunStatus;
import org.neuralchilli.plexor.domain.WorkflowRun;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record RunResponse(
        UUID id,
        String workflow,
        RunStatus status,
        Map<String, Object> params,
        String triggeredBy,
        Instant startedAt,
        Instant endedAt,
        String error
) {
    public static RunResponse from(WorkflowRun run) {
        return new RunResponse(
                run.id(),
                run.workflowName(),
                run.status(),
                run.params(),
                run.triggeredBy(),
                run.startedAt(),
                run.endedAt(),
                run.error()
        );
    }
}
