package com.dagflow.core.repository;

import com.dagflow.core.model.TaskAttemptRecord;
import com.dagflow.core.model.WorkflowRun;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Persistent state of workflow runs and their task attempts.
 *
 * Each run is an independent unit: writes to one run's status are serialized,
 * writes to different runs never contend. Every attempt record is its own unit
 * of mutation, so outcomes reported concurrently for different tasks of the
 * same run never overwrite each other.
 */
public interface RunStateStore {

    /**
     * Save a newly created run.
     *
     * @throws com.dagflow.core.exception.ConflictException if a run with the same id exists
     */
    void createRun(WorkflowRun run);

    Optional<WorkflowRun> findRun(UUID runId);

    /**
     * Atomically read, modify and write a run.
     * The mutation sees the latest stored value and may be invoked under a lock,
     * so it must be fast and side-effect free.
     *
     * @return The stored result of the mutation
     * @throws com.dagflow.core.exception.NotFoundException if the run does not exist
     */
    WorkflowRun updateRun(UUID runId, UnaryOperator<WorkflowRun> mutation);

    /**
     * Record that an attempt is being dispatched, checked against the run's current state.
     *
     * @return The stored RUNNING record
     * @throws com.dagflow.core.exception.ConflictException if the run is already terminal,
     *         if attemptNumber is not the previous attempt plus one, or if the previous
     *         attempt has no recorded outcome yet
     * @throws com.dagflow.core.exception.NotFoundException if the run does not exist
     */
    TaskAttemptRecord beginAttempt(UUID runId, String taskName, int attemptNumber, Instant now);

    /**
     * Atomically read, modify and write a single attempt record.
     *
     * @throws com.dagflow.core.exception.NotFoundException if the attempt does not exist
     */
    TaskAttemptRecord updateAttempt(UUID runId, String taskName, int attemptNumber,
                                    UnaryOperator<TaskAttemptRecord> mutation);

    /**
     * All attempts of a run, ordered by start time then attempt number.
     */
    List<TaskAttemptRecord> findAttempts(UUID runId);

    /**
     * All attempts of one task within a run, ordered by attempt number.
     */
    List<TaskAttemptRecord> findAttempts(UUID runId, String taskName);

    List<WorkflowRun> findRuns(RunQuery query);

    /**
     * Delete terminal runs completed before the cutoff, together with their attempts.
     *
     * @return Number of deleted runs
     */
    int purgeTerminatedBefore(Instant cutoff);
}
