package com.agentboard.core.model;

import com.agentboard.core.BoardException;

/**
 * Thrown when a status name is not one of the board's closed set of statuses.
 */
public class InvalidStatusException extends BoardException {

    private final String status;

    public InvalidStatusException(String status) {
        super("Invalid status: " + status);
        this.status = status;
    }

    public String getStatus() {
        return status;
    }
}
