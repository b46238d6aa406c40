package org.neuralchilli.plexor.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.plexor.core.DagService;
import org.neuralchilli.plexor.core.ExpressionEvaluator;
import org.neuralchilli.plexor.domain.TaskDefinition;
import org.neuralchilli.plexor.domain.Workflow;
import org.neuralchilli.plexor.routing.TaskQueueRouter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates workflow definitions beyond what the domain records check:
 * dependencies, cycles, routing and templates.
 */
@ApplicationScoped
public class WorkflowValidatorService {

    private final DagService dagService;
    private final TaskQueueRouter router;
    private final ExpressionEvaluator expressionEvaluator;

    @Inject
    public WorkflowValidatorService(DagService dagService, TaskQueueRouter router, ExpressionEvaluator expressionEvaluator) {
        this.dagService = dagService;
        this.router = router;
        this.expressionEvaluator = expressionEvaluator;
    }

    /**
     * @throws ValidationException listing every problem found
     */
    public void validate(Workflow workflow) {
        List<String> errors = new ArrayList<>();

        validateTaskNames(workflow, errors);
        validateDependencies(workflow, errors);
        validateRouting(workflow, errors);
        validateTemplates(workflow, errors);

        // Cycle check needs a sound dependency list
        if (errors.isEmpty()) {
            validateNoCycles(workflow, errors);
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(workflow.name(), errors);
        }
    }

    private void validateTaskNames(Workflow workflow, List<String> errors) {
        Set<String> seen = new HashSet<>();
        for (TaskDefinition task : workflow.tasks()) {
            if (!seen.add(task.name())) {
                errors.add("Task '" + task.name() + "' is defined more than once");
            }
            if (task.retries() < 0) {
                errors.add("Task '" + task.name() + "' has negative retries: " + task.retries());
            }
        }
    }

    private void validateDependencies(Workflow workflow, List<String> errors) {
        Set<String> taskNames = new HashSet<>(workflow.taskNames());
        for (TaskDefinition task : workflow.tasks()) {
            for (String dependency : task.dependsOn()) {
                if (dependency.equals(task.name())) {
                    errors.add("Task '" + task.name() + "' depends on itself");
                } else if (!taskNames.contains(dependency)) {
                    errors.add("Task '" + task.name() + "' depends on '" + dependency
                            + "' which is not defined in this workflow");
                }
            }
        }
    }

    private void validateRouting(Workflow workflow, List<String> errors) {
        for (TaskDefinition task : workflow.tasks()) {
            if (!router.canRoute(task.queue())) {
                errors.add("Task '" + task.name() + "' uses queue '" + task.queue()
                        + "' which no executor serves");
            }
        }
    }

    private void validateTemplates(Workflow workflow, List<String> errors) {
        for (Map.Entry<String, String> entry : workflow.env().entrySet()) {
            checkTemplate("Workflow env " + entry.getKey(), entry.getValue(), errors);
        }
        for (TaskDefinition task : workflow.tasks()) {
            for (String arg : task.args()) {
                checkTemplate("Task '" + task.name() + "' argument", arg, errors);
            }
            for (Map.Entry<String, String> entry : task.env().entrySet()) {
                checkTemplate("Task '" + task.name() + "' env " + entry.getKey(), entry.getValue(), errors);
            }
        }
    }

    private void checkTemplate(String what, String value, List<String> errors) {
        String error = expressionEvaluator.getValidationError(value);
        if (error != null) {
            errors.add(what + " has an invalid expression '" + value + "': " + error);
        }
    }

    private void validateNoCycles(Workflow workflow, List<String> errors) {
        try {
            dagService.buildDAG(workflow);
        } catch (CycleDetectedException e) {
            errors.add(e.getMessage());
        }
    }
}
