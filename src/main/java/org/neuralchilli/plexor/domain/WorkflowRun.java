package org.neuralchilli.plexor.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One execution of a workflow with specific parameters.
 * Stored in Hazelcast for distributed state management.
 */
public record WorkflowRun(
        UUID id,
        String workflowName,
        Map<String, Object> params,
        RunStatus status,
        String triggeredBy,
        Instant startedAt,
        Instant endedAt,
        String error
) implements Serializable {

    public WorkflowRun {
        if (id == null) {
            throw new IllegalArgumentException("Run ID cannot be null");
        }
        if (workflowName == null || workflowName.isBlank()) {
            throw new IllegalArgumentException("Workflow name cannot be null or empty");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("Started at cannot be null");
        }

        // Defaults
        if (params == null) {
            params = Map.of();
        }
    }

    /**
     * Create a new run
     */
    public static WorkflowRun create(String workflowName, Map<String, Object> params, String triggeredBy, Instant now) {
        return new WorkflowRun(
                UUID.randomUUID(),
                workflowName,
                params,
                RunStatus.RUNNING,
                triggeredBy,
                now,
                null,
                null
        );
    }

    /**
     * Mark as succeeded
     */
    public WorkflowRun succeed(Instant now) {
        return new WorkflowRun(id, workflowName, params, RunStatus.SUCCESS, triggeredBy, startedAt, now, null);
    }

    /**
     * Mark as failed
     */
    public WorkflowRun fail(String errorMessage, Instant now) {
        return new WorkflowRun(id, workflowName, params, RunStatus.FAILED, triggeredBy, startedAt, now, errorMessage);
    }

    /**
     * Mark as cancelled
     */
    public WorkflowRun cancel(Instant now) {
        return new WorkflowRun(id, workflowName, params, RunStatus.CANCELLED, triggeredBy, startedAt, now, error);
    }

    /**
     * Pause dispatching
     */
    public WorkflowRun pause() {
        if (status != RunStatus.RUNNING) {
            throw new IllegalStateException("Cannot pause run in status: " + status);
        }
        return new WorkflowRun(id, workflowName, params, RunStatus.PAUSED, triggeredBy, startedAt, endedAt, error);
    }

    /**
     * Resume dispatching
     */
    public WorkflowRun resume() {
        if (!status.canResume()) {
            throw new IllegalStateException("Cannot resume run in status: " + status);
        }
        return new WorkflowRun(id, workflowName, params, RunStatus.RUNNING, triggeredBy, startedAt, null, null);
    }

    public boolean isFinished() {
        return status.isTerminal();
    }
}
