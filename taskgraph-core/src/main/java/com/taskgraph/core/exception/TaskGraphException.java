package com.taskgraph.core.exception;

/**
 * Base exception for all engine errors.
 */
public class TaskGraphException extends RuntimeException {

    private final String errorCode;

    public TaskGraphException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TaskGraphException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
