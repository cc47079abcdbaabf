package com.dagflow.engine.scheduler;

import com.dagflow.core.graph.WorkflowGraph;
import com.dagflow.core.model.*;
import com.dagflow.engine.scheduler.SchedulingDecision.Dispatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Decides what a run does next.
 *
 * Both operations are pure functions of their inputs: the Scheduler holds no state and
 * never touches a store. The run loop feeds it a snapshot and applies the result.
 *
 * Eligibility: a task may start when every predecessor's latest attempt succeeded and the
 * task either has no attempt yet, or its latest attempt failed with a retry that is now due.
 * Attempts of one task are strictly ordered; attempt N+1 is only proposed once attempt N
 * has an outcome.
 */
public class Scheduler {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    /**
     * Evaluate a run snapshot.
     *
     * Nothing is dispatched unless the run is RUNNING. A terminal status is proposed only
     * for a non-terminal run:
     * - SUCCEEDED once every task succeeded
     * - FAILED with FAIL_FAST as soon as a task is exhausted
     * - FAILED with FAIL_SLOW once a task is exhausted and no other task can still progress
     *
     * @param attempts Every attempt of the run, in any order
     */
    public SchedulingDecision evaluate(WorkflowGraph graph, WorkflowRun run,
                                       List<TaskAttemptRecord> attempts, Instant now) {
        Map<String, TaskAttemptRecord> latest = latestAttempts(attempts);
        Map<String, TaskProgress> progress = new LinkedHashMap<>();
        List<Dispatch> eligible = new ArrayList<>();
        Instant nextRetryAt = null;

        for (String task : graph.topologicalOrder()) {
            TaskAttemptRecord last = latest.get(task);
            TaskProgress state = progressOf(graph, task, last, progress, now);
            progress.put(task, state);

            if (state == TaskProgress.ELIGIBLE) {
                eligible.add(new Dispatch(task, last == null ? 1 : last.attemptNumber() + 1));
            } else if (state == TaskProgress.RETRY_WAIT
                    && (nextRetryAt == null || last.retryNotBefore().isBefore(nextRetryAt))) {
                nextRetryAt = last.retryNotBefore();
            }
        }

        if (run.isTerminal()) {
            return new SchedulingDecision(progress, List.of(), nextRetryAt, null, null, null);
        }

        boolean allSucceeded = progress.values().stream().allMatch(p -> p == TaskProgress.SUCCEEDED);
        if (allSucceeded) {
            return new SchedulingDecision(progress, List.of(), null, RunStatus.SUCCEEDED, null, null);
        }

        Optional<TaskAttemptRecord> exhausted = firstExhausted(progress, latest);
        if (exhausted.isPresent()) {
            FailurePolicy policy = graph.definition().failurePolicy();
            boolean anyLive = progress.values().stream().anyMatch(TaskProgress::isLive);
            if (policy == FailurePolicy.FAIL_FAST || !anyLive) {
                TaskAttemptRecord cause = exhausted.get();
                String reason = String.format("Task %s failed after %d attempt(s): %s%s",
                    cause.taskName(), cause.attemptNumber(), cause.errorCode(),
                    cause.errorDetail() != null ? " - " + cause.errorDetail() : "");
                log.debug("Run {} fails under {}: {}", run.runId(), policy, reason);
                return new SchedulingDecision(progress, List.of(), null, RunStatus.FAILED,
                    cause.taskName(), reason);
            }
        }

        List<Dispatch> dispatch = run.status() == RunStatus.RUNNING ? eligible : List.of();
        return new SchedulingDecision(progress, dispatch, nextRetryAt, null, null, null);
    }

    private static TaskProgress progressOf(WorkflowGraph graph, String task, TaskAttemptRecord last,
                                           Map<String, TaskProgress> upstream, Instant now) {
        if (last != null) {
            if (last.status() == AttemptStatus.SUCCEEDED) {
                return TaskProgress.SUCCEEDED;
            }
            if (last.status().isActive()) {
                return TaskProgress.IN_FLIGHT;
            }
            if (last.isExhausted()) {
                return TaskProgress.EXHAUSTED;
            }
            return last.retryNotBefore().isAfter(now) ? TaskProgress.RETRY_WAIT : TaskProgress.ELIGIBLE;
        }

        // Predecessors come earlier in topological order, so their progress is known
        boolean allSucceeded = true;
        for (String predecessor : graph.predecessors(task)) {
            TaskProgress p = upstream.get(predecessor);
            if (p.isDead()) {
                return TaskProgress.BLOCKED;
            }
            allSucceeded &= p == TaskProgress.SUCCEEDED;
        }
        return allSucceeded ? TaskProgress.ELIGIBLE : TaskProgress.WAITING;
    }

    /**
     * The exhausted task whose last attempt ended first, ties broken by topological order.
     */
    private static Optional<TaskAttemptRecord> firstExhausted(Map<String, TaskProgress> progress,
                                                              Map<String, TaskAttemptRecord> latest) {
        TaskAttemptRecord first = null;
        for (Map.Entry<String, TaskProgress> entry : progress.entrySet()) {
            if (entry.getValue() != TaskProgress.EXHAUSTED) {
                continue;
            }
            TaskAttemptRecord candidate = latest.get(entry.getKey());
            if (first == null || endedBefore(candidate, first)) {
                first = candidate;
            }
        }
        return Optional.ofNullable(first);
    }

    private static boolean endedBefore(TaskAttemptRecord a, TaskAttemptRecord b) {
        return a.endedAt() != null && b.endedAt() != null && a.endedAt().isBefore(b.endedAt());
    }

    private static Map<String, TaskAttemptRecord> latestAttempts(List<TaskAttemptRecord> attempts) {
        Map<String, TaskAttemptRecord> latest = new HashMap<>();
        for (TaskAttemptRecord attempt : attempts) {
            latest.merge(attempt.taskName(), attempt,
                (a, b) -> b.attemptNumber() > a.attemptNumber() ? b : a);
        }
        return latest;
    }

    /**
     * Apply an attempt's outcome to its record.
     *
     * A failure or timeout stamps {@code retryNotBefore = now + backoff} when another attempt is
     * permitted: the outcome is retryable, the policy retries its error code and attempts remain.
     * Otherwise {@code retryNotBefore} stays null and the task is exhausted.
     * A record that already has an outcome is returned unchanged.
     */
    public TaskAttemptRecord applyOutcome(WorkflowGraph graph, TaskAttemptRecord attempt,
                                          TaskOutcome outcome, Instant now) {
        if (attempt.status().isFinished()) {
            log.debug("Ignoring outcome for finished attempt {}", attempt.key());
            return attempt;
        }
        if (outcome.isSuccess()) {
            return attempt.withSucceeded(outcome.result(), now);
        }

        RetryPolicy policy = retryPolicyOf(graph, attempt.taskName());
        Instant nextAttemptAt = null;
        if (outcome.retryable()
                && policy.shouldRetry(outcome.errorCode())
                && policy.hasMoreAttempts(attempt.attemptNumber())) {
            Duration backoff = policy.computeBackoff(attempt.attemptNumber());
            nextAttemptAt = now.plus(backoff);
        }

        return outcome.isTimedOut()
            ? attempt.withTimedOut(outcome.errorMessage(), now, nextAttemptAt)
            : attempt.withFailed(outcome.errorCode(), outcome.errorMessage(), now, nextAttemptAt);
    }

    public RetryPolicy retryPolicyOf(WorkflowGraph graph, String taskName) {
        return graph.task(taskName).effectiveRetryPolicy(graph.definition().defaultRetryPolicy());
    }
}
