package com.dagflow.engine.persistence;

import com.dagflow.core.exception.ConflictException;
import com.dagflow.core.exception.NotFoundException;
import com.dagflow.core.model.TaskAttemptRecord;
import com.dagflow.core.model.WorkflowRun;
import com.dagflow.core.repository.AttemptGuard;
import com.dagflow.core.repository.RunQuery;
import com.dagflow.core.repository.RunStateStore;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory implementation of RunStateStore.
 *
 * Every run lives in its own cell. Run status writes and attempt dispatch take the cell's
 * lock; attempt outcome writes are per-key atomic on the cell's attempt map. Different runs
 * never share a lock.
 */
public class InMemoryRunStateStore implements RunStateStore {

    private final Map<UUID, RunCell> cells = new ConcurrentHashMap<>();

    private static final class RunCell {
        private final ReentrantLock lock = new ReentrantLock();
        private volatile WorkflowRun run;
        // Key: taskName:attemptNumber
        private final Map<String, TaskAttemptRecord> attempts = new ConcurrentHashMap<>();

        private RunCell(WorkflowRun run) {
            this.run = run;
        }
    }

    private static String attemptKey(String taskName, int attemptNumber) {
        return taskName + ":" + attemptNumber;
    }

    private RunCell cell(UUID runId) {
        RunCell cell = cells.get(runId);
        if (cell == null) {
            throw new NotFoundException("WorkflowRun", String.valueOf(runId));
        }
        return cell;
    }

    @Override
    public void createRun(WorkflowRun run) {
        if (cells.putIfAbsent(run.runId(), new RunCell(run)) != null) {
            throw new ConflictException("WorkflowRun", run.runId().toString(), "already exists");
        }
    }

    @Override
    public Optional<WorkflowRun> findRun(UUID runId) {
        RunCell cell = cells.get(runId);
        return cell != null ? Optional.of(cell.run) : Optional.empty();
    }

    @Override
    public WorkflowRun updateRun(UUID runId, UnaryOperator<WorkflowRun> mutation) {
        RunCell cell = cell(runId);
        cell.lock.lock();
        try {
            WorkflowRun updated = Objects.requireNonNull(mutation.apply(cell.run), "mutation result");
            if (!updated.runId().equals(runId)) {
                throw new IllegalArgumentException("Mutation changed the run id of " + runId);
            }
            cell.run = updated;
            return updated;
        } finally {
            cell.lock.unlock();
        }
    }

    @Override
    public TaskAttemptRecord beginAttempt(UUID runId, String taskName, int attemptNumber, Instant now) {
        RunCell cell = cell(runId);
        cell.lock.lock();
        try {
            AttemptGuard.checkCanBegin(cell.run, taskName, attemptNumber, attemptsOf(cell, taskName));
            TaskAttemptRecord record = TaskAttemptRecord.start(runId, taskName, attemptNumber, now);
            cell.attempts.put(attemptKey(taskName, attemptNumber), record);
            return record;
        } finally {
            cell.lock.unlock();
        }
    }

    @Override
    public TaskAttemptRecord updateAttempt(UUID runId, String taskName, int attemptNumber,
                                           UnaryOperator<TaskAttemptRecord> mutation) {
        RunCell cell = cell(runId);
        String key = attemptKey(taskName, attemptNumber);
        TaskAttemptRecord updated = cell.attempts.computeIfPresent(key, (k, current) ->
            Objects.requireNonNull(mutation.apply(current), "mutation result"));
        if (updated == null) {
            throw new NotFoundException("TaskAttempt", runId + ":" + key);
        }
        return updated;
    }

    @Override
    public List<TaskAttemptRecord> findAttempts(UUID runId) {
        RunCell cell = cells.get(runId);
        if (cell == null) {
            return List.of();
        }
        return cell.attempts.values().stream()
            .sorted(Comparator.comparing(TaskAttemptRecord::startedAt)
                .thenComparing(TaskAttemptRecord::attemptNumber)
                .thenComparing(TaskAttemptRecord::taskName))
            .collect(Collectors.toList());
    }

    @Override
    public List<TaskAttemptRecord> findAttempts(UUID runId, String taskName) {
        RunCell cell = cells.get(runId);
        return cell != null ? attemptsOf(cell, taskName) : List.of();
    }

    private static List<TaskAttemptRecord> attemptsOf(RunCell cell, String taskName) {
        return cell.attempts.values().stream()
            .filter(a -> a.taskName().equals(taskName))
            .sorted(Comparator.comparing(TaskAttemptRecord::attemptNumber))
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowRun> findRuns(RunQuery query) {
        return cells.values().stream()
            .map(c -> c.run)
            .filter(r -> query.definitionName() == null || r.definitionId().name().equals(query.definitionName()))
            .filter(r -> query.definitionVersion() == null || r.definitionId().version() == query.definitionVersion())
            .filter(r -> query.status() == null || r.status() == query.status())
            .sorted(Comparator.comparing(WorkflowRun::createdAt).reversed())
            .limit(query.effectiveLimit())
            .collect(Collectors.toList());
    }

    @Override
    public int purgeTerminatedBefore(Instant cutoff) {
        int purged = 0;
        for (Map.Entry<UUID, RunCell> entry : cells.entrySet()) {
            WorkflowRun run = entry.getValue().run;
            if (run.isTerminal() && run.completedAt() != null && run.completedAt().isBefore(cutoff)
                    && cells.remove(entry.getKey(), entry.getValue())) {
                purged++;
            }
        }
        return purged;
    }

    /**
     * Number of runs currently held, terminal or not.
     */
    public int size() {
        return cells.size();
    }
}
