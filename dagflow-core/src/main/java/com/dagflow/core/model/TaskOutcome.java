package com.dagflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;

/**
 * Result of one task attempt as observed by the engine.
 * Failures and timeouts are values, never exceptions.
 */
public record TaskOutcome(
    Kind kind,
    JsonNode result,
    String errorCode,
    String errorMessage,
    boolean retryable,
    Duration elapsed
) {
    public static final String TASK_FAILURE = "TASK_FAILURE";
    public static final String TASK_TIMEOUT = "TASK_TIMEOUT";
    public static final String HANDLER_NOT_FOUND = "HANDLER_NOT_FOUND";
    public static final String UNEXPECTED_ERROR = "UNEXPECTED_ERROR";
    public static final String EXECUTOR_REJECTED = "EXECUTOR_REJECTED";

    public enum Kind {
        SUCCEEDED,
        FAILED,
        TIMED_OUT
    }

    public static TaskOutcome succeeded(JsonNode result, Duration elapsed) {
        return new TaskOutcome(Kind.SUCCEEDED, result, null, null, false, elapsed);
    }

    public static TaskOutcome failed(String errorCode, String errorMessage, Duration elapsed) {
        return failed(errorCode, errorMessage, true, elapsed);
    }

    public static TaskOutcome failed(String errorCode, String errorMessage, boolean retryable, Duration elapsed) {
        String code = errorCode != null ? errorCode : TASK_FAILURE;
        return new TaskOutcome(Kind.FAILED, null, code, errorMessage, retryable, elapsed);
    }

    public static TaskOutcome timedOut(Duration timeout) {
        return new TaskOutcome(Kind.TIMED_OUT, null, TASK_TIMEOUT,
            "Task attempt exceeded timeout of " + timeout, true, timeout);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCEEDED;
    }

    public boolean isTimedOut() {
        return kind == Kind.TIMED_OUT;
    }
}
