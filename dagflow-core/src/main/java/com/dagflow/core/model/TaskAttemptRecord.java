package com.dagflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * A single attempt to execute a task within a run.
 * Several records exist for the same task when it is retried.
 *
 * Primary Key: (runId, taskName, attemptNumber)
 *
 * Invariants:
 * - attemptNumber starts at 1 and increases by one per retry
 * - result set iff status == SUCCEEDED
 * - errorCode set iff status is FAILED or TIMED_OUT
 * - retryNotBefore set only on a failed attempt whose task may be retried
 */
public record TaskAttemptRecord(
    UUID runId,
    String taskName,
    int attemptNumber,
    AttemptStatus status,
    Instant startedAt,
    Instant endedAt,
    String errorCode,
    String errorDetail,
    JsonNode result,
    Instant retryNotBefore
) {
    public TaskAttemptRecord {
        startedAt = truncate(startedAt);
        endedAt = truncate(endedAt);
        retryNotBefore = truncate(retryNotBefore);
    }

    private static Instant truncate(Instant instant) {
        return instant != null ? instant.truncatedTo(ChronoUnit.MILLIS) : null;
    }

    /**
     * Create the record for an attempt being dispatched now.
     */
    public static TaskAttemptRecord start(UUID runId, String taskName, int attemptNumber, Instant now) {
        return new TaskAttemptRecord(
            runId, taskName, attemptNumber, AttemptStatus.RUNNING,
            now, null, null, null, null, null
        );
    }

    public String key() {
        return runId + ":" + taskName + ":" + attemptNumber;
    }

    /**
     * A failed attempt after which no further attempt is permitted.
     */
    public boolean isExhausted() {
        return status.isFailure() && retryNotBefore == null;
    }

    public TaskAttemptRecord withSucceeded(JsonNode taskResult, Instant endedAt) {
        return new TaskAttemptRecord(
            runId, taskName, attemptNumber, AttemptStatus.SUCCEEDED,
            startedAt, endedAt, null, null, taskResult, null
        );
    }

    public TaskAttemptRecord withFailed(String code, String detail, Instant endedAt, Instant nextAttemptAt) {
        return new TaskAttemptRecord(
            runId, taskName, attemptNumber, AttemptStatus.FAILED,
            startedAt, endedAt, code, detail, null, nextAttemptAt
        );
    }

    public TaskAttemptRecord withTimedOut(String detail, Instant endedAt, Instant nextAttemptAt) {
        return new TaskAttemptRecord(
            runId, taskName, attemptNumber, AttemptStatus.TIMED_OUT,
            startedAt, endedAt, TaskOutcome.TASK_TIMEOUT, detail, null, nextAttemptAt
        );
    }
}
