package com.dagflow.core.model;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A run together with every attempt recorded for it.
 */
public record RunView(WorkflowRun run, List<TaskAttemptRecord> attempts) {

    public RunView {
        attempts = List.copyOf(attempts);
    }

    public List<TaskAttemptRecord> attemptsOf(String taskName) {
        return attempts.stream()
            .filter(a -> a.taskName().equals(taskName))
            .collect(Collectors.toList());
    }

    public Optional<TaskAttemptRecord> latestAttempt(String taskName) {
        return attempts.stream()
            .filter(a -> a.taskName().equals(taskName))
            .reduce((first, second) -> second.attemptNumber() > first.attemptNumber() ? second : first);
    }
}
