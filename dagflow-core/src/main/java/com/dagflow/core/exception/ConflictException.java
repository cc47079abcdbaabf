package com.dagflow.core.exception;

/**
 * Thrown when a concurrent mutation lost a race, e.g. a dispatch racing a cancellation.
 * Callers re-read state before deciding what to do next.
 */
public class ConflictException extends DagflowException {

    public static final String ERROR_CODE = "CONFLICT";

    public ConflictException(String entityType, String entityId, String reason) {
        super(ERROR_CODE, String.format(
            "Conflict on %s[%s]: %s",
            entityType, entityId, reason
        ));
    }
}
