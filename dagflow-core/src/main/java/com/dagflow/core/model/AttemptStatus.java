package com.dagflow.core.model;

/**
 * Lifecycle states for a single task attempt.
 */
public enum AttemptStatus {
    /**
     * Attempt dispatched to the worker pool and not finished yet.
     * Transitions: -> SUCCEEDED, FAILED, TIMED_OUT
     */
    RUNNING,

    SUCCEEDED,

    /**
     * The work unit reported failure. May be followed by another attempt.
     */
    FAILED,

    /**
     * The attempt exceeded its task timeout. Counts as a failure for retries.
     */
    TIMED_OUT;

    /**
     * Check if the attempt has a recorded outcome.
     */
    public boolean isFinished() {
        return this == SUCCEEDED || this == FAILED || this == TIMED_OUT;
    }

    public boolean isFailure() {
        return this == FAILED || this == TIMED_OUT;
    }

    public boolean isActive() {
        return this == RUNNING;
    }
}
