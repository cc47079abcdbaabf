package com.dagflow.core.exception;

import com.dagflow.core.model.RunStatus;
import java.util.UUID;

/**
 * Thrown when a run status change is not allowed by the state machine.
 */
public class InvalidStateTransitionException extends DagflowException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(UUID runId, RunStatus currentStatus, RunStatus targetStatus) {
        super(ERROR_CODE, String.format(
            "Cannot transition run %s from %s to %s",
            runId, currentStatus, targetStatus
        ));
    }
}
