package com.agentboard.core.model;

import java.util.Arrays;
import java.util.List;

/**
 * Status of a task on the board. Each status owns one directory under
 * {@code tasks/}, named by {@link #directoryName()}.
 * <p>
 * Declaration order is the pipeline order followed by {@link #BLOCKED},
 * which is also the order in which the store scans directories.
 */
public enum TaskStatus {
    INBOX("inbox"),
    IN_DISCOVERY("in-discovery"),
    IN_PLANNING("in-planning"),
    READY_TO_BUILD("ready-to-build"),
    IN_PROGRESS("in-progress"),
    READY_FOR_TESTING("ready-for-testing"),
    IN_QA("in-qa"),
    READY_TO_DEPLOY("ready-to-deploy"),
    DEPLOYED("deployed"),
    BLOCKED("blocked");  // side-state, re-enterable from anywhere

    private final String directoryName;

    TaskStatus(String directoryName) {
        this.directoryName = directoryName;
    }

    public String directoryName() {
        return directoryName;
    }

    public boolean isTerminal() {
        return this == DEPLOYED;
    }

    /**
     * The ordered pipeline, without the {@link #BLOCKED} side-state.
     */
    public static List<TaskStatus> pipeline() {
        return Arrays.stream(values()).filter(s -> s != BLOCKED).toList();
    }

    /**
     * Resolves a status from its directory name (e.g. {@code "ready-to-build"}).
     *
     * @throws InvalidStatusException if the name is not one of the closed set
     */
    public static TaskStatus fromDirectoryName(String name) {
        if (name != null) {
            for (TaskStatus status : values()) {
                if (status.directoryName.equals(name)) {
                    return status;
                }
            }
        }
        throw new InvalidStatusException(name);
    }

    @Override
    public String toString() {
        return directoryName;
    }
}
