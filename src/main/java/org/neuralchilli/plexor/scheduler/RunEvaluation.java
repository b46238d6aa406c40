package org.neuralchilli.plexor.scheduler;

import org.neuralchilli.plexor.domain.TaskInstance;
import org.neuralchilli.plexor.domain.Workflow;

import java.util.List;

/**
 * What one evaluation of a run found.
 *
 * @param workflow  definition the run executes, null if it is gone
 * @param ready     instances that may be dispatched now, in topological order
 * @param cancelled instances cancelled before they were dispatched
 * @param skipped   instances skipped because an upstream task did not succeed
 */
public record RunEvaluation(
        Workflow workflow,
        List<TaskInstance> ready,
        int cancelled,
        int skipped
) {
    public RunEvaluation {
        ready = ready != null ? List.copyOf(ready) : List.of();
    }

    public static RunEvaluation none() {
        return new RunEvaluation(null, List.of(), 0, 0);
    }
}
