package org.neuralchilli.plexor.api;

import org.neuralchilli.plexor.domain.TaskDefinition;
import org.neuralchilli.plexor.domain.Workflow;

import java.util.List;
import java.util.Map;

public record WorkflowResponse(
        String name,
        String description,
        Map<String, Object> params,
        List<TaskSummary> tasks
) {
    public record TaskSummary(String name, String queue, int retries, List<String> dependsOn) {
    }

    public static WorkflowResponse from(Workflow workflow) {
        List<TaskSummary> tasks = workflow.tasks().stream()
                .map(WorkflowResponse::summarize)
                .toList();
        return new WorkflowResponse(workflow.name(), workflow.description(), workflow.params(), tasks);
    }

    private static TaskSummary summarize(TaskDefinition task) {
        return new TaskSummary(task.name(), task.queue(), task.retries(), task.dependsOn());
    }
}
