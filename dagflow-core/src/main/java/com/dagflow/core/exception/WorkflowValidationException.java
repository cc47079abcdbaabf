package com.dagflow.core.exception;

import java.util.List;

/**
 * Thrown when a workflow definition is rejected at registration.
 * Carries the offending elements (task names, edges, or the tasks on a cycle).
 */
public class WorkflowValidationException extends DagflowException {

    public static final String ERROR_CODE = "VALIDATION_ERROR";

    private final String field;
    private final List<String> offending;

    public WorkflowValidationException(String field, String reason) {
        this(field, reason, List.of());
    }

    public WorkflowValidationException(String field, String reason, List<String> offending) {
        super(ERROR_CODE, offending.isEmpty()
            ? String.format("Invalid workflow definition: %s - %s", field, reason)
            : String.format("Invalid workflow definition: %s - %s %s", field, reason, offending));
        this.field = field;
        this.offending = List.copyOf(offending);
    }

    public String getField() {
        return field;
    }

    public List<String> getOffending() {
        return offending;
    }
}
