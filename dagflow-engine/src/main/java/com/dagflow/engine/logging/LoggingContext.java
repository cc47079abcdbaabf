package com.dagflow.engine.logging;

import org.slf4j.MDC;

import java.util.Map;
import java.util.UUID;

/**
 * MDC helper for structured logging.
 * Every line logged by a run loop or a task attempt carries the run it belongs to.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forAttempt(runId, "extract", 2)) {
 *     log.info("Attempt started"); // includes runId, taskName, attempt
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [dagflow-worker-3] INFO  c.d.e.c.RunCoordinator - Attempt started
 *   runId=9b1c... definitionId=ingest:2 taskName=extract attempt=2 traceId=4f2a91c0
 */
public final class LoggingContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String DEFINITION_ID = "definitionId";
    public static final String TASK_NAME = "taskName";
    public static final String ATTEMPT = "attempt";
    public static final String TRACE_ID = "traceId";

    // MDC content before this context was opened, restored on close
    private final Map<String, String> previous;

    private LoggingContext() {
        this.previous = MDC.getCopyOfContextMap();
    }

    /**
     * Context for a run loop.
     */
    public static LoggingContext forRun(UUID runId, String definitionId) {
        LoggingContext ctx = new LoggingContext();
        if (runId != null) {
            MDC.put(RUN_ID, runId.toString());
        }
        if (definitionId != null) {
            MDC.put(DEFINITION_ID, definitionId);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Context for a single task attempt.
     */
    public static LoggingContext forAttempt(UUID runId, String taskName, int attempt) {
        return forAttempt(runId, taskName, attempt, null);
    }

    /**
     * Context for a task attempt running on another thread than its run loop.
     *
     * @param traceId Trace id of the run loop, so both sides of the hand-off correlate
     */
    public static LoggingContext forAttempt(UUID runId, String taskName, int attempt, String traceId) {
        LoggingContext ctx = new LoggingContext();
        if (traceId != null) {
            MDC.put(TRACE_ID, traceId);
        }
        if (runId != null) {
            MDC.put(RUN_ID, runId.toString());
        }
        if (taskName != null) {
            MDC.put(TASK_NAME, taskName);
        }
        MDC.put(ATTEMPT, String.valueOf(attempt));
        ensureTraceId();
        return ctx;
    }

    public static String getRunId() {
        return MDC.get(RUN_ID);
    }

    public static String getTaskName() {
        return MDC.get(TASK_NAME);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    /**
     * Restore the MDC as it was when this context was opened.
     * Pooled threads never carry one run's ids into the next.
     */
    @Override
    public void close() {
        if (previous == null || previous.isEmpty()) {
            MDC.clear();
        } else {
            MDC.setContextMap(previous);
        }
    }
}
