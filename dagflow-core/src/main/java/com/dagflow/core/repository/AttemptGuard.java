package com.dagflow.core.repository;

import com.dagflow.core.exception.ConflictException;
import com.dagflow.core.model.TaskAttemptRecord;
import com.dagflow.core.model.WorkflowRun;

import java.util.List;

/**
 * Checks shared by every {@link RunStateStore} before an attempt is recorded.
 * Callers hold the run's write lock while invoking it.
 */
public final class AttemptGuard {

    private AttemptGuard() {
    }

    /**
     * @param previous Earlier attempts of the same task, ordered by attempt number
     * @throws ConflictException if the attempt may not start
     */
    public static void checkCanBegin(WorkflowRun run, String taskName, int attemptNumber,
                                     List<TaskAttemptRecord> previous) {
        String key = run.runId() + ":" + taskName + ":" + attemptNumber;
        if (run.isTerminal()) {
            throw new ConflictException("TaskAttempt", key, "run is already " + run.status());
        }
        int expected = previous.isEmpty() ? 1 : previous.get(previous.size() - 1).attemptNumber() + 1;
        if (attemptNumber != expected) {
            throw new ConflictException("TaskAttempt", key, "expected attempt number " + expected);
        }
        if (!previous.isEmpty() && !previous.get(previous.size() - 1).status().isFinished()) {
            throw new ConflictException("TaskAttempt", key, "previous attempt has no outcome yet");
        }
    }
}
