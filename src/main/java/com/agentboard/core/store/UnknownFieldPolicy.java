package com.agentboard.core.store;

/**
 * What {@link TaskStore#updateTask} does with a field name it cannot update.
 */
public enum UnknownFieldPolicy {
    /** Log a warning and skip the field. */
    IGNORE,
    /** Fail the whole update with {@link IllegalArgumentException}. */
    REJECT
}
