package com.dagflow.core.exception;

/**
 * Base exception for all engine errors.
 */
public class DagflowException extends RuntimeException {

    private final String errorCode;

    public DagflowException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public DagflowException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
