package com.agentboard.core.codec;

import com.agentboard.core.BoardException;

import java.nio.file.Path;

/**
 * Thrown when a stored document (task record, notification ledger,
 * subscriptions file) cannot be parsed.
 */
public class MalformedRecordException extends BoardException {

    private final Path source;

    public MalformedRecordException(Path source, String detail) {
        super("Malformed record " + source + ": " + detail);
        this.source = source;
    }

    public MalformedRecordException(Path source, String detail, Throwable cause) {
        super("Malformed record " + source + ": " + detail, cause);
        this.source = source;
    }

    /** The file the document was read from. */
    public Path getSource() {
        return source;
    }
}
