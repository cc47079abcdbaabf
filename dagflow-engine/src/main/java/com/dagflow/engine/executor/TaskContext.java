package com.dagflow.engine.executor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Context provided to task handlers during execution.
 */
public class TaskContext {

    private final UUID runId;
    private final String taskName;
    private final int attemptNumber;
    private final Map<String, String> parameters;
    private final Map<String, JsonNode> upstreamResults;
    private final BooleanSupplier cancelled;
    private final ObjectMapper objectMapper;

    public TaskContext(
            UUID runId,
            String taskName,
            int attemptNumber,
            Map<String, String> parameters,
            Map<String, JsonNode> upstreamResults,
            BooleanSupplier cancelled,
            ObjectMapper objectMapper) {
        this.runId = runId;
        this.taskName = taskName;
        this.attemptNumber = attemptNumber;
        this.parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        this.upstreamResults = upstreamResults == null ? Map.of() : Map.copyOf(upstreamResults);
        this.cancelled = cancelled != null ? cancelled : () -> false;
        this.objectMapper = objectMapper;
    }

    public UUID getRunId() {
        return runId;
    }

    public String getTaskName() {
        return taskName;
    }

    /**
     * Get the attempt number, starting at 1.
     */
    public int getAttemptNumber() {
        return attemptNumber;
    }

    /**
     * Get the run parameters given at start.
     */
    public Map<String, String> getParameters() {
        return parameters;
    }

    public String getParameter(String name) {
        return parameters.get(name);
    }

    public String getParameter(String name, String defaultValue) {
        return parameters.getOrDefault(name, defaultValue);
    }

    /**
     * Get the result of a direct upstream task, or null if the task has no such dependency.
     */
    public JsonNode getUpstreamResult(String upstreamTask) {
        return upstreamResults.get(upstreamTask);
    }

    /**
     * Get the result of a direct upstream task as a specific type.
     */
    public <T> T getUpstreamResult(String upstreamTask, Class<T> type) {
        JsonNode result = upstreamResults.get(upstreamTask);
        return result != null ? objectMapper.convertValue(result, type) : null;
    }

    public Map<String, JsonNode> getUpstreamResults() {
        return upstreamResults;
    }

    /**
     * Check whether the run was cancelled or the attempt interrupted by its timeout.
     * Long-running handlers should poll this and stop early.
     */
    public boolean isCancelled() {
        return cancelled.getAsBoolean() || Thread.currentThread().isInterrupted();
    }

    /**
     * Convert a result object to JsonNode.
     */
    public JsonNode toJsonNode(Object result) {
        return objectMapper.valueToTree(result);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
