package com.dagflow.engine.scheduler;

/**
 * Where a task stands within one run, derived from its attempts and its predecessors.
 */
public enum TaskProgress {
    /**
     * Latest attempt succeeded.
     */
    SUCCEEDED,

    /**
     * Latest attempt is dispatched and has no outcome yet.
     */
    IN_FLIGHT,

    /**
     * Latest attempt failed and the next one may not start before its backoff elapses.
     */
    RETRY_WAIT,

    /**
     * Every predecessor succeeded and the next attempt may start now.
     */
    ELIGIBLE,

    /**
     * Some predecessor has not succeeded yet but still can.
     */
    WAITING,

    /**
     * Latest attempt failed and no further attempt is permitted.
     */
    EXHAUSTED,

    /**
     * Some predecessor is exhausted or blocked, so this task can never run.
     */
    BLOCKED;

    /**
     * Check if the task can still make progress on its own.
     */
    public boolean isLive() {
        return this == IN_FLIGHT || this == RETRY_WAIT || this == ELIGIBLE;
    }

    public boolean isDead() {
        return this == EXHAUSTED || this == BLOCKED;
    }
}
