package com.agentboard.core.io;

import com.agentboard.core.BoardException;

import java.io.IOException;

/**
 * Thrown when the underlying file system fails (permission denied, disk full, ...)
 * and retrying did not help.
 */
public class StorageException extends BoardException {

    public StorageException(String message, IOException cause) {
        super(message, cause);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
