package com.dagflow.engine.executor;

import com.dagflow.core.model.TaskOutcome;
import com.dagflow.core.model.TaskSpec;
import com.dagflow.engine.logging.LoggingContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Task executor backed by a bounded worker pool shared by every run.
 *
 * The timeout clock of an attempt starts when a worker picks it up, not when it is queued.
 * When the timeout fires first the outcome is TIMED_OUT and the worker thread is interrupted;
 * whatever the handler returns afterwards is ignored.
 */
public class PooledTaskExecutor implements TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(PooledTaskExecutor.class);

    private final TaskHandlerRegistry handlers;
    private final Duration defaultTimeout;
    private final ExecutorService workers;
    private final ScheduledExecutorService timeouts;
    private final AtomicInteger inFlight = new AtomicInteger();

    public PooledTaskExecutor(TaskHandlerRegistry handlers, int poolSize, Duration defaultTimeout) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be >= 1");
        }
        this.handlers = handlers;
        this.defaultTimeout = defaultTimeout != null ? defaultTimeout : TaskSpec.DEFAULT_TIMEOUT;

        CustomizableThreadFactory workerThreads = new CustomizableThreadFactory("dagflow-worker-");
        workerThreads.setDaemon(true);
        this.workers = Executors.newFixedThreadPool(poolSize, workerThreads);

        CustomizableThreadFactory timerThreads = new CustomizableThreadFactory("dagflow-timeout-");
        timerThreads.setDaemon(true);
        this.timeouts = Executors.newSingleThreadScheduledExecutor(timerThreads);
    }

    /**
     * A running attempt. The timeout interrupts the worker only while {@code finished} is false,
     * so a late interrupt can never reach the next attempt on the same thread.
     */
    private static final class RunningAttempt {
        private final Thread worker;
        private boolean finished;

        private RunningAttempt(Thread worker) {
            this.worker = worker;
        }
    }

    @Override
    public CompletableFuture<TaskOutcome> submit(TaskSpec spec, TaskContext context) {
        CompletableFuture<TaskOutcome> outcome = new CompletableFuture<>();

        Optional<TaskHandler> handler = handlers.find(spec.executableRef());
        if (handler.isEmpty()) {
            log.warn("No handler registered for {} (task {})", spec.executableRef(), spec.name());
            outcome.complete(TaskOutcome.failed(TaskOutcome.HANDLER_NOT_FOUND,
                "No handler registered for " + spec.executableRef(), false, Duration.ZERO));
            return outcome;
        }

        inFlight.incrementAndGet();
        outcome.whenComplete((o, e) -> inFlight.decrementAndGet());

        String traceId = MDC.get(LoggingContext.TRACE_ID);
        try {
            workers.execute(() -> runAttempt(handler.get(), spec, context, traceId, outcome));
        } catch (RejectedExecutionException e) {
            log.warn("Worker pool rejected task {} attempt {}", spec.name(), context.getAttemptNumber());
            outcome.complete(TaskOutcome.failed(TaskOutcome.EXECUTOR_REJECTED,
                "Worker pool is not accepting work", Duration.ZERO));
        }
        return outcome;
    }

    private void runAttempt(TaskHandler handler, TaskSpec spec, TaskContext context, String traceId,
                            CompletableFuture<TaskOutcome> outcome) {
        Duration timeout = spec.effectiveTimeout(defaultTimeout);
        RunningAttempt attempt = new RunningAttempt(Thread.currentThread());
        long startNanos = System.nanoTime();

        ScheduledFuture<?> timer = timeouts.schedule(
            () -> expire(attempt, spec, timeout, outcome), timeout.toMillis(), TimeUnit.MILLISECONDS);

        try (LoggingContext ignored = LoggingContext.forAttempt(
                context.getRunId(), spec.name(), context.getAttemptNumber(), traceId)) {
            log.debug("Executing {} via {}", spec.name(), spec.executableRef());
            try {
                JsonNode result = handler.execute(context);
                outcome.complete(TaskOutcome.succeeded(
                    result != null ? result : NullNode.getInstance(), elapsedSince(startNanos)));
            } catch (TaskException e) {
                outcome.complete(TaskOutcome.failed(
                    e.getErrorCode(), e.getMessage(), e.isRetryable(), elapsedSince(startNanos)));
            } catch (RuntimeException e) {
                if (!outcome.isDone()) {
                    log.error("Task {} threw an unexpected exception", spec.name(), e);
                }
                outcome.complete(TaskOutcome.failed(
                    TaskOutcome.UNEXPECTED_ERROR, e.toString(), elapsedSince(startNanos)));
            } finally {
                timer.cancel(false);
                synchronized (attempt) {
                    attempt.finished = true;
                }
                // Clear an interrupt the timeout may have delivered
                Thread.interrupted();
                if (!outcome.isDone()) {
                    outcome.complete(TaskOutcome.failed(TaskOutcome.UNEXPECTED_ERROR,
                        "Task ended without an outcome", elapsedSince(startNanos)));
                }
            }
        }
    }

    private void expire(RunningAttempt attempt, TaskSpec spec, Duration timeout,
                        CompletableFuture<TaskOutcome> outcome) {
        synchronized (attempt) {
            if (!attempt.finished && outcome.complete(TaskOutcome.timedOut(timeout))) {
                log.warn("Task {} exceeded its timeout of {}, interrupting worker", spec.name(), timeout);
                attempt.worker.interrupt();
            }
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    @Override
    public int inFlightCount() {
        return inFlight.get();
    }

    @Override
    public void shutdown(Duration timeout) {
        log.info("Shutting down worker pool ({} attempts in flight)", inFlight.get());
        workers.shutdown();
        try {
            if (!workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Worker pool did not drain within {}, interrupting workers", timeout);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            timeouts.shutdownNow();
        }
    }
}
