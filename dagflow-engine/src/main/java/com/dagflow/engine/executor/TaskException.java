package com.dagflow.engine.executor;

/**
 * Exception thrown by task handlers on failure.
 * A non-retryable failure exhausts the task whatever attempts remain.
 */
public class TaskException extends Exception {

    private final String errorCode;
    private final boolean retryable;

    public TaskException(String errorCode, String message) {
        this(errorCode, message, true);
    }

    public TaskException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public TaskException(String errorCode, String message, Throwable cause) {
        this(errorCode, message, cause, true);
    }

    public TaskException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Create a non-retryable exception (permanent failure).
     */
    public static TaskException permanent(String errorCode, String message) {
        return new TaskException(errorCode, message, false);
    }

    /**
     * Create a retryable exception (transient failure).
     */
    public static TaskException transientFailure(String errorCode, String message) {
        return new TaskException(errorCode, message, true);
    }
}
