package org.neuralchilli.plexor.core;

import org.neuralchilli.plexor.domain.TaskAttemptId;

import java.util.Map;

/**
 * Variables visible to task templates: run parameters, merged environment
 * and the identity of the attempt being rendered.
 */
public record ExpressionContext(
        Map<String, Object> params,
        Map<String, String> env,
        Map<String, Object> run
) {
    public ExpressionContext {
        if (params == null) {
            params = Map.of();
        }
        if (env == null) {
            env = Map.of();
        }
        if (run == null) {
            run = Map.of();
        }
    }

    /**
     * Context for one task attempt of a workflow run
     */
    public static ExpressionContext forAttempt(
            String workflowName,
            TaskAttemptId attemptId,
            Map<String, Object> params,
            Map<String, String> env
    ) {
        return new ExpressionContext(params, env, Map.of(
                "id", attemptId.runId().toString(),
                "workflow", workflowName,
                "task", attemptId.taskId(),
                "attempt", attemptId.attempt()
        ));
    }

    /**
     * Create a context with only parameters
     */
    public static ExpressionContext withParams(Map<String, Object> params) {
        return new ExpressionContext(params, Map.of(), Map.of());
    }

    public static ExpressionContext empty() {
        return new ExpressionContext(Map.of(), Map.of(), Map.of());
    }
}
