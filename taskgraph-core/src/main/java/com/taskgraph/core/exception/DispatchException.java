package com.taskgraph.core.exception;

/**
 * Thrown when a message could not be handed to the transport.
 */
public class DispatchException extends TaskGraphException {

    public static final String ERROR_CODE = "DISPATCH_FAILED";

    public DispatchException(String message) {
        super(ERROR_CODE, message);
    }

    public DispatchException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
