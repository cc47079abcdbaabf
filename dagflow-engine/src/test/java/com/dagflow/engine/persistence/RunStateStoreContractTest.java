package com.dagflow.engine.persistence;

import com.dagflow.core.exception.ConflictException;
import com.dagflow.core.exception.NotFoundException;
import com.dagflow.core.model.*;
import com.dagflow.core.repository.RunQuery;
import com.dagflow.core.repository.RunStateStore;
import com.dagflow.core.test.TimeController;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Behavior every {@link RunStateStore} must share. Subclasses supply the store.
 */
public abstract class RunStateStoreContractTest {

    private static final DefinitionId ETL = DefinitionId.of("etl", 1);

    protected final TimeController time = TimeController.frozen();
    protected final ObjectMapper objectMapper = new ObjectMapper();
    protected RunStateStore store;

    protected abstract RunStateStore createStore();

    @BeforeEach
    protected void setUpStore() {
        store = createStore();
    }

    private WorkflowRun newRunningRun() {
        WorkflowRun run = WorkflowRun.create(ETL, Map.of("date", "2024-01-15"), time.instant());
        store.createRun(run);
        return store.updateRun(run.runId(), r -> r.withStatus(RunStatus.RUNNING, time.instant()));
    }

    @Test
    void createRun_shouldBeReadBack() {
        WorkflowRun run = WorkflowRun.create(ETL, Map.of("date", "2024-01-15"), time.instant());

        store.createRun(run);

        assertThat(store.findRun(run.runId())).contains(run);
    }

    @Test
    void createRun_shouldRejectDuplicateId() {
        WorkflowRun run = WorkflowRun.create(ETL, Map.of(), time.instant());
        store.createRun(run);

        assertThatThrownBy(() -> store.createRun(run))
            .isInstanceOf(ConflictException.class);
    }

    @Test
    void findRun_shouldBeEmptyForUnknownRun() {
        assertThat(store.findRun(UUID.randomUUID())).isEmpty();
    }

    @Test
    void updateRun_shouldPersistMutationAndBumpSequence() {
        WorkflowRun run = newRunningRun();
        time.advanceSeconds(3);

        WorkflowRun failed = store.updateRun(run.runId(),
            r -> r.withFailure("load", "Task load failed", time.instant()));

        assertThat(failed.sequenceNumber()).isEqualTo(run.sequenceNumber() + 1);
        assertThat(store.findRun(run.runId())).contains(failed);
        assertThat(failed.completedAt()).isEqualTo(time.instant());
        assertThat(failed.failedTaskName()).isEqualTo("load");
    }

    @Test
    void updateRun_shouldRejectUnknownRun() {
        assertThatThrownBy(() -> store.updateRun(UUID.randomUUID(), r -> r))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void beginAttempt_shouldRecordRunningAttempt() {
        WorkflowRun run = newRunningRun();

        TaskAttemptRecord attempt = store.beginAttempt(run.runId(), "extract", 1, time.instant());

        assertThat(attempt.status()).isEqualTo(AttemptStatus.RUNNING);
        assertThat(store.findAttempts(run.runId())).containsExactly(attempt);
    }

    @Test
    @DisplayName("No attempt may start once the run is terminal")
    void beginAttempt_shouldRejectTerminalRun() {
        WorkflowRun run = newRunningRun();
        store.updateRun(run.runId(), r -> r.withStatus(RunStatus.CANCELLED, time.instant()));

        assertThatThrownBy(() -> store.beginAttempt(run.runId(), "extract", 1, time.instant()))
            .isInstanceOf(ConflictException.class)
            .hasMessageContaining("CANCELLED");
        assertThat(store.findAttempts(run.runId())).isEmpty();
    }

    @Test
    void beginAttempt_shouldRejectSkippedAttemptNumber() {
        WorkflowRun run = newRunningRun();

        assertThatThrownBy(() -> store.beginAttempt(run.runId(), "extract", 2, time.instant()))
            .isInstanceOf(ConflictException.class)
            .hasMessageContaining("expected attempt number 1");
    }

    @Test
    void beginAttempt_shouldRejectRetryWhilePreviousAttemptRuns() {
        WorkflowRun run = newRunningRun();
        store.beginAttempt(run.runId(), "extract", 1, time.instant());

        assertThatThrownBy(() -> store.beginAttempt(run.runId(), "extract", 2, time.instant()))
            .isInstanceOf(ConflictException.class)
            .hasMessageContaining("no outcome yet");
    }

    @Test
    void beginAttempt_shouldRejectUnknownRun() {
        assertThatThrownBy(() -> store.beginAttempt(UUID.randomUUID(), "extract", 1, time.instant()))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void updateAttempt_shouldRecordResult() {
        WorkflowRun run = newRunningRun();
        store.beginAttempt(run.runId(), "extract", 1, time.instant());
        ObjectNode result = objectMapper.createObjectNode().put("rows", 42);
        time.advanceSeconds(2);

        TaskAttemptRecord recorded = store.updateAttempt(run.runId(), "extract", 1,
            a -> a.withSucceeded(result, time.instant()));

        assertThat(recorded.result()).isEqualTo(result);
        assertThat(store.findAttempts(run.runId(), "extract")).containsExactly(recorded);
    }

    @Test
    void updateAttempt_shouldRejectUnknownAttempt() {
        WorkflowRun run = newRunningRun();

        assertThatThrownBy(() -> store.updateAttempt(run.runId(), "extract", 1, a -> a))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void retriedAttempts_shouldBeListedInOrder() {
        WorkflowRun run = newRunningRun();
        store.beginAttempt(run.runId(), "extract", 1, time.instant());
        store.updateAttempt(run.runId(), "extract", 1,
            a -> a.withFailed("IO", "reset", time.instant(), time.instant().plusSeconds(1)));
        time.advanceSeconds(1);
        store.beginAttempt(run.runId(), "extract", 2, time.instant());
        time.advanceSeconds(1);
        store.beginAttempt(run.runId(), "audit", 1, time.instant());

        List<TaskAttemptRecord> attempts = store.findAttempts(run.runId());

        assertThat(attempts).extracting(TaskAttemptRecord::key).containsExactly(
            run.runId() + ":extract:1", run.runId() + ":extract:2", run.runId() + ":audit:1");
        assertThat(attempts.get(0).retryNotBefore()).isEqualTo(attempts.get(1).startedAt());
    }

    @Test
    @DisplayName("Concurrent outcomes for different tasks of one run are all kept")
    void updateAttempt_shouldNotLoseConcurrentWrites() throws Exception {
        WorkflowRun run = newRunningRun();
        int tasks = 8;
        for (int i = 0; i < tasks; i++) {
            store.beginAttempt(run.runId(), "task-" + i, 1, time.instant());
        }

        ExecutorService pool = Executors.newFixedThreadPool(tasks);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < tasks; i++) {
            String task = "task-" + i;
            int value = i;
            futures.add(pool.submit(() -> {
                start.await();
                return store.updateAttempt(run.runId(), task, 1,
                    a -> a.withSucceeded(objectMapper.getNodeFactory().numberNode(value), time.instant()));
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(store.findAttempts(run.runId()))
            .hasSize(tasks)
            .allMatch(a -> a.status() == AttemptStatus.SUCCEEDED);
    }

    @Test
    @DisplayName("Racing dispatches of the same attempt record it once")
    void beginAttempt_shouldAdmitOneOfConcurrentDuplicates() throws Exception {
        WorkflowRun run = newRunningRun();
        int racers = 6;
        ExecutorService pool = Executors.newFixedThreadPool(racers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < racers; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                try {
                    store.beginAttempt(run.runId(), "extract", 1, time.instant());
                    admitted.incrementAndGet();
                } catch (ConflictException e) {
                    rejected.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(admitted.get()).isEqualTo(1);
        assertThat(rejected.get()).isEqualTo(racers - 1);
        assertThat(store.findAttempts(run.runId())).hasSize(1);
    }

    @Test
    void findRuns_shouldFilterAndOrderNewestFirst() {
        WorkflowRun first = WorkflowRun.create(ETL, Map.of(), time.instant());
        time.advanceSeconds(1);
        WorkflowRun second = WorkflowRun.create(ETL, Map.of(), time.instant());
        time.advanceSeconds(1);
        WorkflowRun other = WorkflowRun.create(DefinitionId.of("report", 1), Map.of(), time.instant());
        store.createRun(first);
        store.createRun(second);
        store.createRun(other);
        store.updateRun(second.runId(), r -> r.withStatus(RunStatus.CANCELLED, time.instant()));

        assertThat(store.findRuns(RunQuery.byDefinition("etl")))
            .extracting(WorkflowRun::runId)
            .containsExactly(second.runId(), first.runId());
        assertThat(store.findRuns(RunQuery.byStatus(RunStatus.CANCELLED)))
            .extracting(WorkflowRun::runId)
            .containsExactly(second.runId());
        assertThat(store.findRuns(new RunQuery(null, null, null, 1)))
            .extracting(WorkflowRun::runId)
            .containsExactly(other.runId());
    }

    @Test
    void purgeTerminatedBefore_shouldKeepActiveAndRecentRuns() {
        WorkflowRun old = newRunningRun();
        store.beginAttempt(old.runId(), "extract", 1, time.instant());
        store.updateRun(old.runId(), r -> r.withStatus(RunStatus.CANCELLED, time.instant()));
        WorkflowRun active = newRunningRun();
        time.advance(Duration.ofDays(2));
        WorkflowRun recent = newRunningRun();
        store.updateRun(recent.runId(), r -> r.withStatus(RunStatus.SUCCEEDED, time.instant()));

        int purged = store.purgeTerminatedBefore(time.instant().minus(Duration.ofDays(1)));

        assertThat(purged).isEqualTo(1);
        assertThat(store.findRun(old.runId())).isEmpty();
        assertThat(store.findAttempts(old.runId())).isEmpty();
        assertThat(store.findRun(active.runId())).isPresent();
        assertThat(store.findRun(recent.runId())).isPresent();
    }
}
