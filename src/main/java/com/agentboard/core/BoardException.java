package com.agentboard.core;

/**
 * Base type for failures raised by the task board. Callers that want to treat
 * every board failure uniformly can catch this; the subclasses identify the kind.
 */
public class BoardException extends RuntimeException {

    public BoardException(String message) {
        super(message);
    }

    public BoardException(String message, Throwable cause) {
        super(message, cause);
    }
}
