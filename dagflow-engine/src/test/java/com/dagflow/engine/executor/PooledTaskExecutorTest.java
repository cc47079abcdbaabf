package com.dagflow.engine.executor;

import com.dagflow.core.model.TaskOutcome;
import com.dagflow.core.model.TaskSpec;
import com.dagflow.engine.logging.LoggingContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

class PooledTaskExecutorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TaskHandlerRegistry handlers = new TaskHandlerRegistry();
    private PooledTaskExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown(Duration.ofSeconds(5));
        }
    }

    private TaskContext context(String taskName) {
        return new TaskContext(UUID.randomUUID(), taskName, 1, Map.of("region", "eu"), Map.of(),
            () -> false, objectMapper);
    }

    private static TaskSpec spec(String name, String ref, Duration timeout) {
        return TaskSpec.builder().name(name).executableRef(ref).timeout(timeout).build();
    }

    @Test
    void execute_shouldReturnHandlerResult() {
        handlers.register("echo", ctx -> TextNode.valueOf(ctx.getParameter("region")));
        executor = new PooledTaskExecutor(handlers, 2, Duration.ofSeconds(5));

        TaskOutcome outcome = executor.execute(spec("echo", "echo", Duration.ofSeconds(5)), context("echo"));

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.result()).isEqualTo(TextNode.valueOf("eu"));
        assertThat(outcome.elapsed()).isNotNull();
    }

    @Test
    void execute_shouldTurnNullResultIntoJsonNull() {
        handlers.register("nothing", ctx -> null);
        executor = new PooledTaskExecutor(handlers, 1, Duration.ofSeconds(5));

        TaskOutcome outcome = executor.execute(spec("nothing", "nothing", null), context("nothing"));

        assertThat(outcome.result()).isEqualTo(NullNode.getInstance());
    }

    @Test
    void execute_shouldReportTaskExceptionAsFailure() {
        handlers.register("flaky", ctx -> {
            throw TaskException.transientFailure("THROTTLED", "slow down");
        });
        handlers.register("broken", ctx -> {
            throw TaskException.permanent("INVALID_INPUT", "bad row");
        });
        executor = new PooledTaskExecutor(handlers, 2, Duration.ofSeconds(5));

        TaskOutcome transientOutcome = executor.execute(spec("flaky", "flaky", Duration.ofSeconds(5)), context("flaky"));
        TaskOutcome permanentOutcome = executor.execute(spec("broken", "broken", Duration.ofSeconds(5)), context("broken"));

        assertThat(transientOutcome.kind()).isEqualTo(TaskOutcome.Kind.FAILED);
        assertThat(transientOutcome.errorCode()).isEqualTo("THROTTLED");
        assertThat(transientOutcome.errorMessage()).isEqualTo("slow down");
        assertThat(transientOutcome.retryable()).isTrue();
        assertThat(permanentOutcome.errorCode()).isEqualTo("INVALID_INPUT");
        assertThat(permanentOutcome.retryable()).isFalse();
    }

    @Test
    void execute_shouldReportUncheckedExceptionAsUnexpectedError() {
        handlers.register("npe", ctx -> {
            throw new IllegalStateException("oops");
        });
        executor = new PooledTaskExecutor(handlers, 1, Duration.ofSeconds(5));

        TaskOutcome outcome = executor.execute(spec("npe", "npe", Duration.ofSeconds(5)), context("npe"));

        assertThat(outcome.errorCode()).isEqualTo(TaskOutcome.UNEXPECTED_ERROR);
        assertThat(outcome.errorMessage()).contains("oops");
        assertThat(outcome.retryable()).isTrue();
    }

    @Test
    void execute_shouldFailPermanentlyWithoutHandler() {
        executor = new PooledTaskExecutor(handlers, 1, Duration.ofSeconds(5));

        TaskOutcome outcome = executor.execute(spec("ghost", "not.registered", Duration.ofSeconds(5)), context("ghost"));

        assertThat(outcome.errorCode()).isEqualTo(TaskOutcome.HANDLER_NOT_FOUND);
        assertThat(outcome.retryable()).isFalse();
    }

    @Test
    @DisplayName("Timeout yields TIMED_OUT and interrupts the worker")
    void execute_shouldTimeOutAndInterrupt() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        handlers.register("hang", ctx -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return IntNode.valueOf(1);
        });
        executor = new PooledTaskExecutor(handlers, 1, Duration.ofSeconds(5));

        TaskOutcome outcome = executor.execute(spec("hang", "hang", Duration.ofMillis(100)), context("hang"));

        assertThat(outcome.isTimedOut()).isTrue();
        assertThat(outcome.errorCode()).isEqualTo(TaskOutcome.TASK_TIMEOUT);
        assertThat(outcome.retryable()).isTrue();
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void execute_shouldApplyDefaultTimeoutWhenSpecHasNone() {
        handlers.register("hang", ctx -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        });
        executor = new PooledTaskExecutor(handlers, 1, Duration.ofMillis(100));

        TaskOutcome outcome = executor.execute(spec("hang", "hang", null), context("hang"));

        assertThat(outcome.isTimedOut()).isTrue();
    }

    @Test
    @DisplayName("Tasks declared without a timeout use the executor's configured default")
    void execute_shouldApplyConfiguredDefaultToShorthandSpec() {
        handlers.register("hang", ctx -> {
            try {
                Thread.sleep(1_500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return IntNode.valueOf(1);
        });
        executor = new PooledTaskExecutor(handlers, 1, Duration.ofMillis(100));
        TaskSpec spec = TaskSpec.of("hang", "hang");

        TaskOutcome outcome = executor.execute(spec, context("hang"));

        assertThat(spec.timeout()).isNull();
        assertThat(outcome.isTimedOut()).isTrue();
        assertThat(outcome.errorMessage()).contains("PT0.1S");
    }

    @Test
    @DisplayName("Time spent queued for a worker does not count against the timeout")
    void execute_shouldStartTimeoutOnPickup() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        handlers.register("blocker", ctx -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        });
        handlers.register("quick", ctx -> IntNode.valueOf(7));
        executor = new PooledTaskExecutor(handlers, 1, Duration.ofSeconds(5));

        CompletableFuture<TaskOutcome> blocker = executor.submit(
            spec("blocker", "blocker", Duration.ofSeconds(10)), context("blocker"));
        CompletableFuture<TaskOutcome> queued = executor.submit(
            spec("quick", "quick", Duration.ofMillis(200)), context("quick"));
        Thread.sleep(400);
        release.countDown();

        assertThat(blocker.get(5, TimeUnit.SECONDS).isSuccess()).isTrue();
        assertThat(queued.get(5, TimeUnit.SECONDS).isSuccess()).isTrue();
    }

    @Test
    void interruptFromTimeout_shouldNotLeakIntoNextAttempt() throws Exception {
        AtomicBoolean sawInterrupt = new AtomicBoolean();
        handlers.register("hang", ctx -> {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (!ctx.isCancelled() && System.nanoTime() < deadline) {
                Thread.onSpinWait();
            }
            return null;
        });
        handlers.register("check", ctx -> {
            sawInterrupt.set(Thread.currentThread().isInterrupted());
            return null;
        });
        executor = new PooledTaskExecutor(handlers, 1, Duration.ofSeconds(5));

        assertThat(executor.execute(spec("hang", "hang", Duration.ofMillis(50)), context("hang")).isTimedOut()).isTrue();
        TaskOutcome next = executor.execute(spec("check", "check", Duration.ofSeconds(5)), context("check"));

        assertThat(next.isSuccess()).isTrue();
        assertThat(sawInterrupt.get()).isFalse();
    }

    @Test
    void submit_shouldCarryTraceIdToWorker() {
        AtomicReference<String> seen = new AtomicReference<>();
        handlers.register("trace", ctx -> {
            seen.set(MDC.get(LoggingContext.TRACE_ID));
            return null;
        });
        executor = new PooledTaskExecutor(handlers, 1, Duration.ofSeconds(5));

        String traceId;
        try (LoggingContext ignored = LoggingContext.forRun(UUID.randomUUID(), "etl:1")) {
            traceId = LoggingContext.getTraceId();
            executor.execute(spec("trace", "trace", Duration.ofSeconds(5)), context("trace"));
        }

        assertThat(seen.get()).isEqualTo(traceId);
    }

    @Test
    void submit_shouldRejectAfterShutdown() {
        handlers.register("echo", ctx -> IntNode.valueOf(1));
        executor = new PooledTaskExecutor(handlers, 1, Duration.ofSeconds(5));
        executor.shutdown(Duration.ofSeconds(1));

        TaskOutcome outcome = executor.execute(spec("echo", "echo", Duration.ofSeconds(5)), context("echo"));

        assertThat(outcome.errorCode()).isEqualTo(TaskOutcome.EXECUTOR_REJECTED);
        assertThat(executor.inFlightCount()).isZero();
    }

    @Test
    void constructor_shouldRejectEmptyPool() {
        assertThatThrownBy(() -> new PooledTaskExecutor(handlers, 0, Duration.ofSeconds(1)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
