package com.dagflow.core.model;

/**
 * Lifecycle states for a workflow run.
 * Transitions follow a strict state machine, see {@link #canTransitionTo}.
 */
public enum RunStatus {
    /**
     * Run created, coordinator loop not yet started.
     * Transitions: -> RUNNING, CANCELLED
     */
    PENDING,

    /**
     * Tasks are being dispatched.
     * Transitions: -> SUCCEEDED, FAILED, CANCELLED
     */
    RUNNING,

    /**
     * Every task has a succeeded attempt. Terminal state.
     */
    SUCCEEDED,

    /**
     * A task exhausted its attempts. Terminal state.
     */
    FAILED,

    /**
     * Cancellation was requested. Terminal state.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(RunStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING || target == CANCELLED;
            case RUNNING -> target == SUCCEEDED || target == FAILED || target == CANCELLED;
            case SUCCEEDED, FAILED, CANCELLED -> false;
        };
    }
}
