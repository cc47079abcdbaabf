package com.dagflow.core.model;

/**
 * What a run does once a task has permanently failed.
 */
public enum FailurePolicy {
    /**
     * Mark the run FAILED as soon as any task exhausts its attempts.
     * In-flight attempts finish but nothing new is dispatched.
     */
    FAIL_FAST,

    /**
     * Keep dispatching independent branches; mark the run FAILED only
     * once no task can make further progress.
     */
    FAIL_SLOW
}
