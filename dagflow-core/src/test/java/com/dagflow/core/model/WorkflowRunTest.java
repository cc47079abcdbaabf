package com.dagflow.core.model;

import com.dagflow.core.exception.InvalidStateTransitionException;
import com.dagflow.core.test.TimeController;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class WorkflowRunTest {

    private final TimeController time = TimeController.frozen();

    @Test
    void create_shouldStartPendingWithoutTimestamps() {
        WorkflowRun run = WorkflowRun.create(DefinitionId.of("etl", 1), Map.of("region", "eu"), time.instant());

        assertThat(run.status()).isEqualTo(RunStatus.PENDING);
        assertThat(run.parameters()).containsEntry("region", "eu");
        assertThat(run.startedAt()).isNull();
        assertThat(run.completedAt()).isNull();
        assertThat(run.sequenceNumber()).isZero();
    }

    @Test
    void withStatus_shouldStampStartAndCompletion() {
        WorkflowRun run = WorkflowRun.create(DefinitionId.of("etl", 1), Map.of(), time.instant());

        WorkflowRun running = run.withStatus(RunStatus.RUNNING, time.instant());
        time.advanceSeconds(30);
        WorkflowRun done = running.withStatus(RunStatus.SUCCEEDED, time.instant());

        assertThat(running.startedAt()).isEqualTo(run.createdAt());
        assertThat(done.startedAt()).isEqualTo(running.startedAt());
        assertThat(done.completedAt()).isEqualTo(time.instant());
        assertThat(done.sequenceNumber()).isEqualTo(2);
    }

    @Test
    void withStatus_shouldRejectLeavingTerminalState() {
        WorkflowRun cancelled = WorkflowRun.create(DefinitionId.of("etl", 1), Map.of(), time.instant())
            .withStatus(RunStatus.CANCELLED, time.instant());

        assertThatThrownBy(() -> cancelled.withStatus(RunStatus.RUNNING, time.instant()))
            .isInstanceOf(InvalidStateTransitionException.class)
            .hasMessageContaining("CANCELLED");
    }

    @Test
    void withFailure_shouldRecordFailedTask() {
        WorkflowRun failed = WorkflowRun.create(DefinitionId.of("etl", 1), Map.of(), time.instant())
            .withStatus(RunStatus.RUNNING, time.instant())
            .withFailure("load", "disk full", time.instant());

        assertThat(failed.status()).isEqualTo(RunStatus.FAILED);
        assertThat(failed.failedTaskName()).isEqualTo("load");
        assertThat(failed.lastError()).isEqualTo("disk full");
        assertThat(failed.completedAt()).isNotNull();
    }

    @Test
    void definitionId_shouldParseItsOwnStringForm() {
        DefinitionId id = DefinitionId.of("nightly:etl", 3);

        assertThat(DefinitionId.parse(id.toString())).isEqualTo(id);
        assertThatThrownBy(() -> DefinitionId.parse("no-version"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
