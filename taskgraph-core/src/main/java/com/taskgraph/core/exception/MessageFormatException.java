package com.taskgraph.core.exception;

/**
 * Thrown when a channel payload cannot be encoded or decoded.
 */
public class MessageFormatException extends TaskGraphException {

    public static final String ERROR_CODE = "MALFORMED_MESSAGE";

    public MessageFormatException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
