package com.dagflow.engine.scheduler;

import com.dagflow.core.model.RunStatus;

import java.time.Instant;
import java.util.*;

/**
 * What the run loop should do after evaluating a run snapshot.
 *
 * @param progress       Progress of every task, in topological order
 * @param dispatch       Attempts to start now, in topological order
 * @param nextRetryAt    Earliest instant a waiting retry becomes due, null if none
 * @param terminalStatus Status the run must move to, null if it stays as is
 * @param failedTask     Task that caused a FAILED terminal status
 * @param reason         Human readable cause of a FAILED terminal status
 */
public record SchedulingDecision(
    Map<String, TaskProgress> progress,
    List<Dispatch> dispatch,
    Instant nextRetryAt,
    RunStatus terminalStatus,
    String failedTask,
    String reason
) {
    public SchedulingDecision {
        progress = Collections.unmodifiableMap(new LinkedHashMap<>(progress));
        dispatch = List.copyOf(dispatch);
    }

    /**
     * One attempt to start.
     */
    public record Dispatch(String taskName, int attemptNumber) {}

    public boolean isTerminal() {
        return terminalStatus != null;
    }

    public TaskProgress progressOf(String taskName) {
        return progress.get(taskName);
    }

    public List<String> tasksIn(TaskProgress state) {
        List<String> names = new ArrayList<>();
        progress.forEach((name, p) -> {
            if (p == state) {
                names.add(name);
            }
        });
        return names;
    }

    public boolean hasInFlight() {
        return progress.containsValue(TaskProgress.IN_FLIGHT);
    }
}
