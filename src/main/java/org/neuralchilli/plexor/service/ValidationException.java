package org.neuralchilli.plexor.service;

import java.util.List;

/**
 * A workflow definition failed validation. Carries every problem found.
 */
public class ValidationException extends RuntimeException {

    private final List<String> errors;

    public ValidationException(String workflowName, List<String> errors) {
        super("Workflow validation failed for '" + workflowName + "':\n" + String.join("\n", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
