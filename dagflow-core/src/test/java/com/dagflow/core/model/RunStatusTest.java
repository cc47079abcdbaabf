package com.dagflow.core.model;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class RunStatusTest {

    @Test
    void isTerminal_shouldIdentifyTerminalStates() {
        assertTrue(RunStatus.SUCCEEDED.isTerminal());
        assertTrue(RunStatus.FAILED.isTerminal());
        assertTrue(RunStatus.CANCELLED.isTerminal());

        assertFalse(RunStatus.PENDING.isTerminal());
        assertFalse(RunStatus.RUNNING.isTerminal());
    }

    @Test
    void canTransitionTo_fromPending_shouldAllowRunningOrCancelled() {
        assertTrue(RunStatus.PENDING.canTransitionTo(RunStatus.RUNNING));
        assertTrue(RunStatus.PENDING.canTransitionTo(RunStatus.CANCELLED));

        assertFalse(RunStatus.PENDING.canTransitionTo(RunStatus.SUCCEEDED));
        assertFalse(RunStatus.PENDING.canTransitionTo(RunStatus.FAILED));
    }

    @Test
    void canTransitionTo_fromRunning_shouldAllowAnyTerminal() {
        assertTrue(RunStatus.RUNNING.canTransitionTo(RunStatus.SUCCEEDED));
        assertTrue(RunStatus.RUNNING.canTransitionTo(RunStatus.FAILED));
        assertTrue(RunStatus.RUNNING.canTransitionTo(RunStatus.CANCELLED));

        assertFalse(RunStatus.RUNNING.canTransitionTo(RunStatus.PENDING));
    }

    @Test
    void canTransitionTo_fromTerminalStates_shouldNotAllowAny() {
        for (RunStatus terminal : new RunStatus[]{RunStatus.SUCCEEDED, RunStatus.FAILED, RunStatus.CANCELLED}) {
            for (RunStatus target : RunStatus.values()) {
                assertFalse(terminal.canTransitionTo(target), terminal + " -> " + target);
            }
        }
    }
}
