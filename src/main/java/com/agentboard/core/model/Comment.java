package com.agentboard.core.model;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * A single entry in a task's discussion thread.
 *
 * @param timestamp when the comment was posted, kept at minute precision
 * @param agent     the agent that wrote the comment
 * @param message   free text, may span several lines
 */
public record Comment(
    LocalDateTime timestamp,
    String agent,
    String message
) {
    public Comment {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(agent, "agent");
        timestamp = timestamp.truncatedTo(ChronoUnit.MINUTES);
        message = message == null ? "" : message;
    }
}
