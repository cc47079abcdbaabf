package com.dagflow.engine.coordinator;

import com.dagflow.core.exception.ConflictException;
import com.dagflow.core.exception.NotFoundException;
import com.dagflow.core.exception.WorkflowValidationException;
import com.dagflow.core.graph.WorkflowGraph;
import com.dagflow.core.model.*;
import com.dagflow.core.repository.RunQuery;
import com.dagflow.core.repository.RunStateStore;
import com.dagflow.engine.config.EngineProperties;
import com.dagflow.engine.executor.TaskContext;
import com.dagflow.engine.executor.TaskExecutor;
import com.dagflow.engine.logging.LoggingContext;
import com.dagflow.engine.metrics.EngineMetrics;
import com.dagflow.engine.registry.WorkflowRegistry;
import com.dagflow.engine.scheduler.Scheduler;
import com.dagflow.engine.scheduler.SchedulingDecision;
import com.dagflow.engine.scheduler.SchedulingDecision.Dispatch;
import com.dagflow.engine.service.WorkflowEngine;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the lifecycle of runs: creates them, drives each one to a terminal status and
 * handles cancellation.
 *
 * Every run gets its own loop on the coordinator pool:
 * evaluate snapshot -> dispatch eligible attempts -> wait for a completion event -> repeat.
 * The wait on the run's event queue is the only place a loop blocks. Outcomes are recorded
 * by the executor's completion callback before the loop is woken, so each evaluation sees
 * every outcome that woke it.
 *
 * Cancellation moves the run to CANCELLED at once. Attempts already running are left to
 * finish and their outcomes are recorded, but nothing is dispatched after them.
 */
public class RunCoordinator implements WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(RunCoordinator.class);

    // Upper bound on a wait: changes made through another engine instance raise no event
    private static final Duration MAX_WAIT = Duration.ofSeconds(1);

    private final WorkflowRegistry registry;
    private final RunStateStore store;
    private final TaskExecutor executor;
    private final Scheduler scheduler;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final ExecutorService loops;

    private final Map<UUID, RunHandle> active = new ConcurrentHashMap<>();
    private final AtomicBoolean accepting = new AtomicBoolean(true);

    public RunCoordinator(
            WorkflowRegistry registry,
            RunStateStore store,
            TaskExecutor executor,
            EngineMetrics metrics,
            EngineProperties properties,
            Clock clock,
            ObjectMapper objectMapper) {
        this.registry = registry;
        this.store = store;
        this.executor = executor;
        this.scheduler = new Scheduler();
        this.metrics = metrics;
        this.clock = clock;
        this.objectMapper = objectMapper;

        CustomizableThreadFactory threads = new CustomizableThreadFactory("dagflow-run-");
        threads.setDaemon(true);
        this.loops = Executors.newFixedThreadPool(properties.getCoordinatorPoolSize(), threads);
    }

    /**
     * In-process state of a run whose loop has not ended.
     */
    private static final class RunHandle {
        private final UUID runId;
        private final WorkflowGraph graph;
        private final BlockingQueue<RunEvent> events = new LinkedBlockingQueue<>();
        private final AtomicBoolean cancelled = new AtomicBoolean();
        // Attempt keys dispatched and not yet recorded
        private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
        private final CompletableFuture<WorkflowRun> finished = new CompletableFuture<>();
        private volatile String traceId;

        private RunHandle(UUID runId, WorkflowGraph graph) {
            this.runId = runId;
            this.graph = graph;
        }

        private String workflowName() {
            return graph.id().name();
        }
    }

    private record RunEvent(Type type, String attemptKey) {
        enum Type {
            OUTCOME_RECORDED,
            CANCEL_REQUESTED
        }
    }

    // ========== WorkflowEngine ==========

    @Override
    public WorkflowDefinition register(WorkflowDefinition definition) {
        return registry.register(definition);
    }

    @Override
    public UUID start(DefinitionId definitionId, Map<String, String> parameters) {
        if (!accepting.get()) {
            throw new IllegalStateException("Engine is shutting down, not accepting runs");
        }
        WorkflowDefinition definition = registry.get(definitionId);
        if (definition.deprecated()) {
            throw new WorkflowValidationException("definitionId", "is deprecated", List.of(definitionId.toString()));
        }
        WorkflowGraph graph = registry.graph(definitionId);

        WorkflowRun run = WorkflowRun.create(definitionId, parameters, clock.instant());
        store.createRun(run);
        RunHandle handle = new RunHandle(run.runId(), graph);
        active.put(run.runId(), handle);
        metrics.runStarted(definitionId.name());
        log.info("Created run {} of {}", run.runId(), definitionId);

        try {
            loops.execute(() -> drive(handle));
        } catch (RejectedExecutionException e) {
            active.remove(run.runId());
            WorkflowRun cancelled = store.updateRun(run.runId(),
                r -> r.isTerminal() ? r : r.withStatus(RunStatus.CANCELLED, clock.instant()));
            handle.finished.complete(cancelled);
            throw new IllegalStateException("Engine is shutting down, not accepting runs", e);
        }
        return run.runId();
    }

    @Override
    public UUID startLatest(String workflowName, Map<String, String> parameters) {
        return start(registry.getLatest(workflowName).id(), parameters);
    }

    @Override
    public void cancel(UUID runId) {
        RunHandle handle = active.get(runId);
        if (handle != null) {
            handle.cancelled.set(true);
        }

        AtomicBoolean transitioned = new AtomicBoolean();
        WorkflowRun run;
        try {
            run = store.updateRun(runId, current -> {
                if (current.isTerminal()) {
                    return current;
                }
                transitioned.set(true);
                return current.withStatus(RunStatus.CANCELLED, clock.instant());
            });
        } catch (NotFoundException e) {
            log.debug("Cancel ignored for unknown run {}", runId);
            return;
        }

        if (transitioned.get()) {
            log.info("Run {} cancelled", runId);
            metrics.runFinished(run.definitionId().name(), RunStatus.CANCELLED, durationOf(run));
        } else {
            log.debug("Cancel ignored, run {} is already {}", runId, run.status());
        }
        if (handle != null) {
            handle.events.offer(new RunEvent(RunEvent.Type.CANCEL_REQUESTED, null));
        }
    }

    @Override
    public WorkflowRun status(UUID runId) {
        return store.findRun(runId)
            .orElseThrow(() -> new NotFoundException("WorkflowRun", String.valueOf(runId)));
    }

    @Override
    public RunView describe(UUID runId) {
        WorkflowRun run = status(runId);
        return new RunView(run, store.findAttempts(runId));
    }

    @Override
    public WorkflowRun await(UUID runId, Duration timeout) throws InterruptedException {
        RunHandle handle = active.get(runId);
        if (handle != null) {
            try {
                return handle.finished.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.debug("Run {} still active after {}", runId, timeout);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Run loop of " + runId + " ended abnormally", e.getCause());
            }
        }
        return status(runId);
    }

    @Override
    public List<WorkflowRun> listRuns(RunQuery query) {
        return store.findRuns(query);
    }

    // ========== Run Loop ==========

    private void drive(RunHandle handle) {
        metrics.runLoopStarted();
        WorkflowRun run = null;
        try (LoggingContext ignored = LoggingContext.forRun(handle.runId, handle.graph.id().toString())) {
            handle.traceId = LoggingContext.getTraceId();
            try {
                run = store.updateRun(handle.runId, r -> r.status() == RunStatus.PENDING
                    ? r.withStatus(RunStatus.RUNNING, clock.instant())
                    : r);
                if (run.status() == RunStatus.RUNNING) {
                    log.info("Run started: {} tasks, roots {}", handle.graph.size(), handle.graph.roots());
                }
                run = loop(handle);
                log.info("Run loop finished with status {}", run.status());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Run loop interrupted, run left as stored");
            } catch (RuntimeException e) {
                log.error("Run loop failed", e);
                run = failAbandoned(handle, e);
            }
        } finally {
            metrics.runLoopEnded();
            active.remove(handle.runId);
            handle.finished.complete(latest(handle.runId, run));
        }
    }

    private WorkflowRun loop(RunHandle handle) throws InterruptedException {
        while (true) {
            WorkflowRun run = status(handle.runId);
            List<TaskAttemptRecord> attempts = store.findAttempts(handle.runId);
            SchedulingDecision decision = scheduler.evaluate(handle.graph, run, attempts, clock.instant());
            log.debug("Evaluated run: {}", decision.progress());

            if (decision.isTerminal()) {
                run = finish(handle, decision);
            }
            if (run.isTerminal() && handle.inFlight.isEmpty()) {
                return run;
            }
            if (!run.isTerminal() && !handle.cancelled.get()) {
                for (Dispatch next : decision.dispatch()) {
                    dispatch(handle, run, next, attempts);
                }
            }
            awaitEvent(handle, decision.nextRetryAt());
        }
    }

    private void awaitEvent(RunHandle handle, Instant nextRetryAt) throws InterruptedException {
        long waitMs = MAX_WAIT.toMillis();
        if (nextRetryAt != null) {
            long untilRetry = Duration.between(clock.instant(), nextRetryAt).toMillis() + 1;
            waitMs = Math.max(0, Math.min(waitMs, untilRetry));
        }
        RunEvent event = handle.events.poll(waitMs, TimeUnit.MILLISECONDS);
        if (event != null) {
            log.debug("Woken by {}", event);
            // The store is re-read on every pass, so pending events carry nothing new
            handle.events.clear();
        }
    }

    private WorkflowRun finish(RunHandle handle, SchedulingDecision decision) {
        AtomicBoolean transitioned = new AtomicBoolean();
        WorkflowRun run = store.updateRun(handle.runId, current -> {
            if (current.isTerminal()) {
                return current;
            }
            transitioned.set(true);
            Instant now = clock.instant();
            return decision.terminalStatus() == RunStatus.FAILED
                ? current.withFailure(decision.failedTask(), decision.reason(), now)
                : current.withStatus(decision.terminalStatus(), now);
        });

        if (transitioned.get()) {
            if (run.status() == RunStatus.FAILED) {
                log.warn("Run failed: {}", run.lastError());
            } else {
                log.info("Run {}", run.status());
            }
            metrics.runFinished(handle.workflowName(), run.status(), durationOf(run));
        }
        return run;
    }

    private void dispatch(RunHandle handle, WorkflowRun run, Dispatch next, List<TaskAttemptRecord> attempts) {
        String taskName = next.taskName();
        TaskAttemptRecord started;
        try {
            started = store.beginAttempt(handle.runId, taskName, next.attemptNumber(), clock.instant());
        } catch (ConflictException e) {
            log.warn("Dispatch of {} attempt {} discarded: {}", taskName, next.attemptNumber(), e.getMessage());
            return;
        }

        handle.inFlight.add(started.key());
        metrics.attemptStarted(handle.workflowName(), taskName, started.attemptNumber());
        if (started.attemptNumber() > 1) {
            log.info("Retrying task {} (attempt {})", taskName, started.attemptNumber());
        } else {
            log.info("Dispatching task {}", taskName);
        }

        TaskContext context = new TaskContext(
            handle.runId,
            taskName,
            started.attemptNumber(),
            run.parameters(),
            upstreamResults(handle.graph, taskName, attempts),
            handle.cancelled::get,
            objectMapper
        );
        executor.submit(handle.graph.task(taskName), context)
            .whenComplete((outcome, error) -> onOutcome(handle, started, outcome, error));
    }

    private static Map<String, JsonNode> upstreamResults(WorkflowGraph graph, String taskName,
                                                         List<TaskAttemptRecord> attempts) {
        Map<String, JsonNode> results = new LinkedHashMap<>();
        for (String predecessor : graph.predecessors(taskName)) {
            attempts.stream()
                .filter(a -> a.taskName().equals(predecessor) && a.status() == AttemptStatus.SUCCEEDED)
                .findFirst()
                .ifPresent(a -> results.put(predecessor, a.result() != null ? a.result() : NullNode.getInstance()));
        }
        return results;
    }

    /**
     * Completion callback, runs on whichever thread completed the attempt.
     */
    private void onOutcome(RunHandle handle, TaskAttemptRecord started, TaskOutcome outcome, Throwable error) {
        TaskOutcome effective = error == null
            ? outcome
            : TaskOutcome.failed(TaskOutcome.UNEXPECTED_ERROR, error.toString(), Duration.ZERO);

        try (LoggingContext ignored = LoggingContext.forAttempt(
                handle.runId, started.taskName(), started.attemptNumber(), handle.traceId)) {
            TaskAttemptRecord recorded = store.updateAttempt(
                handle.runId, started.taskName(), started.attemptNumber(),
                current -> scheduler.applyOutcome(handle.graph, current, effective, clock.instant()));

            boolean willRetry = recorded.status().isFailure() && !recorded.isExhausted();
            metrics.attemptFinished(handle.workflowName(), started.taskName(), effective, willRetry);

            if (recorded.status() == AttemptStatus.SUCCEEDED) {
                log.info("Task {} succeeded (attempt {})", recorded.taskName(), recorded.attemptNumber());
            } else if (willRetry) {
                log.warn("Task {} attempt {} {} with {}, next attempt not before {}",
                    recorded.taskName(), recorded.attemptNumber(), recorded.status(),
                    recorded.errorCode(), recorded.retryNotBefore());
            } else {
                log.warn("Task {} exhausted after attempt {}: {} {}",
                    recorded.taskName(), recorded.attemptNumber(), recorded.errorCode(), recorded.errorDetail());
            }
            if (handle.cancelled.get()) {
                log.debug("Outcome of {} recorded after cancellation, nothing will follow", started.key());
            }
        } catch (RuntimeException e) {
            log.error("Failed to record outcome of {}", started.key(), e);
        } finally {
            handle.inFlight.remove(started.key());
            handle.events.offer(new RunEvent(RunEvent.Type.OUTCOME_RECORDED, started.key()));
        }
    }

    private WorkflowRun failAbandoned(RunHandle handle, RuntimeException cause) {
        try {
            return store.updateRun(handle.runId, r -> r.status() == RunStatus.RUNNING
                ? r.withFailure(null, "Run loop failed: " + cause, clock.instant())
                : r);
        } catch (RuntimeException e) {
            log.error("Could not mark run {} failed", handle.runId, e);
            return null;
        }
    }

    private WorkflowRun latest(UUID runId, WorkflowRun fallback) {
        try {
            return store.findRun(runId).orElse(fallback);
        } catch (RuntimeException e) {
            log.warn("Could not read final state of run {}: {}", runId, e.getMessage());
            return fallback;
        }
    }

    private static Duration durationOf(WorkflowRun run) {
        Instant from = run.startedAt() != null ? run.startedAt() : run.createdAt();
        return from != null && run.completedAt() != null ? Duration.between(from, run.completedAt()) : null;
    }

    // ========== Lifecycle ==========

    public boolean isAccepting() {
        return accepting.get();
    }

    public int activeRunCount() {
        return active.size();
    }

    public Set<UUID> activeRunIds() {
        return Set.copyOf(active.keySet());
    }

    /**
     * Stop accepting runs, wait up to the timeout for active run loops to finish, then shut
     * the worker pool down. Nothing is cancelled.
     */
    public void shutdown(Duration timeout) {
        if (!accepting.compareAndSet(true, false)) {
            return;
        }
        log.info("Shutting down coordinator: {} active runs", active.size());
        loops.shutdown();
        try {
            if (!loops.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} runs still active after {}, interrupting run loops", active.size(), timeout);
                loops.shutdownNow();
            }
        } catch (InterruptedException e) {
            loops.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor.shutdown(timeout);
        log.info("Coordinator shut down");
    }
}
