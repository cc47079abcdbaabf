package com.dagflow.engine.retention;

import com.dagflow.core.model.DefinitionId;
import com.dagflow.core.model.RunStatus;
import com.dagflow.core.model.WorkflowRun;
import com.dagflow.core.test.TimeController;
import com.dagflow.engine.persistence.InMemoryRunStateStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RetentionPurgerTest {

    private final TimeController time = TimeController.frozen();
    private final InMemoryRunStateStore store = new InMemoryRunStateStore();
    private final RetentionPurger purger = new RetentionPurger(store, time, Duration.ofDays(7), Duration.ofHours(1));

    private WorkflowRun run(RunStatus finalStatus) {
        WorkflowRun run = WorkflowRun.create(DefinitionId.of("etl", 1), Map.of(), time.instant());
        store.createRun(run);
        WorkflowRun running = store.updateRun(run.runId(), r -> r.withStatus(RunStatus.RUNNING, time.instant()));
        return finalStatus == RunStatus.RUNNING
            ? running
            : store.updateRun(run.runId(), r -> r.withStatus(finalStatus, time.instant()));
    }

    @Test
    void purgeNow_shouldDeleteOnlyExpiredTerminalRuns() {
        WorkflowRun expired = run(RunStatus.SUCCEEDED);
        WorkflowRun stillRunning = run(RunStatus.RUNNING);
        time.advance(Duration.ofDays(6));
        WorkflowRun recent = run(RunStatus.CANCELLED);
        time.advance(Duration.ofDays(2));

        int purged = purger.purgeNow();

        assertThat(purged).isEqualTo(1);
        assertThat(store.findRun(expired.runId())).isEmpty();
        assertThat(store.findRun(stillRunning.runId())).isPresent();
        assertThat(store.findRun(recent.runId())).isPresent();
    }

    @Test
    void purgeNow_shouldBeNoOpWhenNothingExpired() {
        run(RunStatus.FAILED);

        assertThat(purger.purgeNow()).isZero();
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void startAndStop_shouldToggleRunning() {
        purger.start();
        assertThat(purger.isRunning()).isTrue();

        purger.stop();
        assertThat(purger.isRunning()).isFalse();
    }
}
