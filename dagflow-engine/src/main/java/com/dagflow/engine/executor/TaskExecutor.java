package com.dagflow.engine.executor;

import com.dagflow.core.model.TaskOutcome;
import com.dagflow.core.model.TaskSpec;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Runs single task attempts and reports a three-way outcome.
 * Failures and timeouts are outcome values; the returned futures never complete exceptionally.
 */
public interface TaskExecutor {

    /**
     * Start an attempt and return its eventual outcome.
     * The task timeout is enforced by the executor.
     */
    CompletableFuture<TaskOutcome> submit(TaskSpec spec, TaskContext context);

    /**
     * Run an attempt and block until its outcome is known.
     */
    default TaskOutcome execute(TaskSpec spec, TaskContext context) {
        return submit(spec, context).join();
    }

    /**
     * Attempts submitted and not yet finished.
     */
    int inFlightCount();

    /**
     * Stop accepting attempts and wait up to the timeout for running ones.
     */
    void shutdown(Duration timeout);
}
