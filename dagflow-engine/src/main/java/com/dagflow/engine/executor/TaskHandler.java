package com.dagflow.engine.executor;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A task's unit of work, registered under the executable reference that task specs point at.
 */
@FunctionalInterface
public interface TaskHandler {

    /**
     * Execute one attempt of the task.
     *
     * @param context Execution context providing parameters, upstream results and utilities
     * @return The task result, may be null
     * @throws TaskException if the attempt fails
     */
    JsonNode execute(TaskContext context) throws TaskException;
}
