package com.dagflow.core.model;

import com.dagflow.core.exception.InvalidStateTransitionException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.UUID;

/**
 * A single execution of a WorkflowDefinition.
 * The dependency structure is never stored here; it is looked up from the definition.
 *
 * Primary Key: runId
 *
 * Invariants:
 * - definitionId never changes after creation
 * - status transitions follow {@link RunStatus#canTransitionTo}
 * - completedAt set iff status is terminal
 * - sequenceNumber increases on every mutation
 */
public record WorkflowRun(
    UUID runId,
    DefinitionId definitionId,
    RunStatus status,
    Map<String, String> parameters,

    // Timing
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,

    // Error tracking
    String failedTaskName,
    String lastError,

    // Versioning
    long sequenceNumber
) {
    public WorkflowRun {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    /**
     * Create a new run in PENDING state.
     */
    public static WorkflowRun create(DefinitionId definitionId, Map<String, String> parameters, Instant now) {
        return new WorkflowRun(
            UUID.randomUUID(),
            definitionId,
            RunStatus.PENDING,
            parameters,
            now.truncatedTo(ChronoUnit.MILLIS),
            null,
            null,
            null,
            null,
            0L
        );
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Copy with the status moved forward.
     *
     * @throws InvalidStateTransitionException if the state machine forbids the move
     */
    public WorkflowRun withStatus(RunStatus newStatus, Instant now) {
        if (!status.canTransitionTo(newStatus)) {
            throw new InvalidStateTransitionException(runId, status, newStatus);
        }
        Instant at = now.truncatedTo(ChronoUnit.MILLIS);
        return new WorkflowRun(
            runId, definitionId, newStatus, parameters, createdAt,
            newStatus == RunStatus.RUNNING && startedAt == null ? at : startedAt,
            newStatus.isTerminal() ? at : null,
            failedTaskName, lastError, sequenceNumber + 1
        );
    }

    /**
     * Copy moved to FAILED, recording the task that caused it.
     */
    public WorkflowRun withFailure(String taskName, String error, Instant now) {
        WorkflowRun failed = withStatus(RunStatus.FAILED, now);
        return new WorkflowRun(
            runId, definitionId, failed.status(), parameters, createdAt,
            failed.startedAt(), failed.completedAt(), taskName, error, failed.sequenceNumber()
        );
    }
}
