package com.dagflow.engine.metrics;

import com.dagflow.core.model.RunStatus;
import com.dagflow.core.model.TaskOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the engine.
 *
 * Metrics exposed:
 * - Runs started and finished, by outcome
 * - Attempts started, retries, timeouts and task failures
 * - Attempt and run durations
 * - Active runs and in-flight attempts
 *
 * Until {@link #bindTo} is called, meters go to an empty composite registry and are dropped.
 */
public class EngineMetrics implements MeterBinder {

    // Metric names
    public static final String RUNS_STARTED = "dagflow.runs.started";
    public static final String RUNS_FINISHED = "dagflow.runs.finished";
    public static final String RUN_DURATION = "dagflow.run.duration";
    public static final String RUNS_ACTIVE = "dagflow.runs.active";

    public static final String ATTEMPTS_STARTED = "dagflow.attempts.started";
    public static final String ATTEMPTS_IN_FLIGHT = "dagflow.attempts.in_flight";
    public static final String ATTEMPT_DURATION = "dagflow.attempt.duration";
    public static final String TASK_RETRIES = "dagflow.task.retries";
    public static final String TASK_FAILURES = "dagflow.task.failures";
    public static final String TASK_TIMEOUTS = "dagflow.task.timeouts";

    private volatile MeterRegistry registry = new CompositeMeterRegistry();

    private final AtomicInteger activeRuns = new AtomicInteger();
    private final AtomicInteger inFlightAttempts = new AtomicInteger();

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(RUNS_ACTIVE, activeRuns, AtomicInteger::get)
            .description("Runs whose coordinator loop is still running")
            .register(registry);
        Gauge.builder(ATTEMPTS_IN_FLIGHT, inFlightAttempts, AtomicInteger::get)
            .description("Task attempts dispatched and not yet finished")
            .register(registry);
    }

    // ========== Run Metrics ==========

    public void runStarted(String workflowName) {
        Counter.builder(RUNS_STARTED)
            .tag("workflow", workflowName)
            .description("Total runs started")
            .register(registry)
            .increment();
    }

    public void runFinished(String workflowName, RunStatus status, Duration duration) {
        String outcome = status.name().toLowerCase();
        Counter.builder(RUNS_FINISHED)
            .tag("workflow", workflowName)
            .tag("status", outcome)
            .description("Total runs that reached a terminal status")
            .register(registry)
            .increment();

        if (duration != null) {
            Timer.builder(RUN_DURATION)
                .tag("workflow", workflowName)
                .tag("status", outcome)
                .description("Run duration from start to terminal status")
                .register(registry)
                .record(duration);
        }
    }

    public void runLoopStarted() {
        activeRuns.incrementAndGet();
    }

    public void runLoopEnded() {
        activeRuns.updateAndGet(v -> Math.max(0, v - 1));
    }

    // ========== Attempt Metrics ==========

    public void attemptStarted(String workflowName, String taskName, int attemptNumber) {
        inFlightAttempts.incrementAndGet();
        Counter.builder(ATTEMPTS_STARTED)
            .tag("workflow", workflowName)
            .tag("task", taskName)
            .description("Total task attempts dispatched")
            .register(registry)
            .increment();

        if (attemptNumber > 1) {
            Counter.builder(TASK_RETRIES)
                .tag("workflow", workflowName)
                .tag("task", taskName)
                .description("Total task retry attempts")
                .register(registry)
                .increment();
        }
    }

    public void attemptFinished(String workflowName, String taskName, TaskOutcome outcome, boolean willRetry) {
        inFlightAttempts.updateAndGet(v -> Math.max(0, v - 1));

        String result = switch (outcome.kind()) {
            case SUCCEEDED -> "success";
            case FAILED -> "failure";
            case TIMED_OUT -> "timeout";
        };
        if (outcome.elapsed() != null) {
            Timer.builder(ATTEMPT_DURATION)
                .tag("workflow", workflowName)
                .tag("task", taskName)
                .tag("outcome", result)
                .description("Task attempt duration")
                .register(registry)
                .record(outcome.elapsed());
        }

        if (outcome.isSuccess()) {
            return;
        }
        Counter.builder(TASK_FAILURES)
            .tag("workflow", workflowName)
            .tag("task", taskName)
            .tag("error_code", outcome.errorCode())
            .tag("will_retry", String.valueOf(willRetry))
            .description("Total failed task attempts, timeouts included")
            .register(registry)
            .increment();

        if (outcome.isTimedOut()) {
            Counter.builder(TASK_TIMEOUTS)
                .tag("workflow", workflowName)
                .tag("task", taskName)
                .description("Total task attempts that exceeded their timeout")
                .register(registry)
                .increment();
        }
    }

    public int getActiveRuns() {
        return activeRuns.get();
    }

    public int getInFlightAttempts() {
        return inFlightAttempts.get();
    }
}
